package com.deepcheck.common.consensus;

import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Verdict;

import java.util.List;

/**
 * Builds the human-readable explanation attached to a {@link ConsensusResult}: a one-line
 * summary of how the sources related, followed by the lead judgment's rationale.
 */
final class ExplanationComposer {

    private ExplanationComposer() {}

    static String compose(Verdict verdict, boolean agreement, List<Judgment> contributing, Judgment lead) {
        String header;
        if (contributing.size() == 1) {
            header = "Single-source result (" + lead.source() + "): " + verdict + ".";
        } else if (agreement) {
            header = "Both sources agree: " + verdict + ".";
        } else {
            Judgment first  = contributing.get(0);
            Judgment second = contributing.get(1);
            header = String.format("Sources disagree (%s: %s, %s: %s); resolved to %s.",
                first.source(), first.verdict(), second.source(), second.verdict(), verdict);
        }
        String rationale = lead.rationale();
        return rationale.isBlank() ? header : header + " " + rationale;
    }
}
