package com.deepcheck.common.consensus;

import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.MetadataAlignment;
import com.deepcheck.common.model.Verdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link ConsensusEngine}: reconciles two independent classifier judgments.
 *
 * <h3>Two judgments J1, J2</h3>
 * <pre>
 *   same decisive verdict      → agreement, conf = min(1, avg + agreementBonus)
 *   different decisive verdict → higher confidence wins (tie → MANIPULATED/FALSE first),
 *                                conf = max(0, winner − disagreementPenalty)
 *   one UNCERTAIN              → decisive one wins, conf = max(0, decisive − partialPenalty)
 *   explanation rationale      → always from the higher-confidence judgment
 *   both UNCERTAIN             → UNCERTAIN, conf = avg
 * </pre>
 *
 * <h3>One judgment (degraded)</h3>
 * <pre>
 *   verdict unchanged, conf = confidence × degradedFactor, agreement = false
 * </pre>
 *
 * <p>Findings are concatenated J1 → J2 → supplementary, never deduplicated.
 *
 * <p>This class is stateless and thread-safe.
 */
public class DualSourceConsensusStrategy implements ConsensusEngine {

    private final ConsensusSettings settings;

    public DualSourceConsensusStrategy() {
        this(ConsensusSettings.DEFAULTS);
    }

    public DualSourceConsensusStrategy(ConsensusSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ConsensusSettings settings() {
        return settings;
    }

    @Override
    public ConsensusResult compute(List<Judgment> judgments, List<Finding> supplementary) {
        List<Finding> extra = supplementary == null ? List.of() : supplementary;
        return switch (judgments.size()) {
            case 1  -> single(judgments.get(0), extra);
            case 2  -> pair(judgments.get(0), judgments.get(1), extra);
            default -> throw new IllegalArgumentException(
                "Consensus needs one or two judgments but got " + judgments.size());
        };
    }

    private ConsensusResult single(Judgment j, List<Finding> extra) {
        double confidence = clamp(j.confidence() * settings.degradedFactor());
        return build(j.verdict(), confidence, false, List.of(j), extra, j);
    }

    private ConsensusResult pair(Judgment j1, Judgment j2, List<Finding> extra) {
        Verdict v1 = j1.verdict();
        Verdict v2 = j2.verdict();
        double avg = (j1.confidence() + j2.confidence()) / 2.0;

        // both abstained
        if (!v1.isDecisive() && !v2.isDecisive()) {
            return build(Verdict.UNCERTAIN, clamp(avg), true, List.of(j1, j2), extra, higherConfidence(j1, j2));
        }

        // one abstained
        if (!v1.isDecisive() || !v2.isDecisive()) {
            Judgment decisive = v1.isDecisive() ? j1 : j2;
            double confidence = clamp(decisive.confidence() - settings.partialPenalty());
            return build(decisive.verdict(), confidence, false, List.of(j1, j2), extra, higherConfidence(j1, j2));
        }

        if (v1 == v2) {
            double confidence = clamp(Math.min(1.0, avg + settings.agreementBonus()));
            return build(v1, confidence, true, List.of(j1, j2), extra, higherConfidence(j1, j2));
        }

        Judgment winner = resolveContradiction(j1, j2);
        double confidence = clamp(winner.confidence() - settings.disagreementPenalty());
        return build(winner.verdict(), confidence, false, List.of(j1, j2), extra, winner);
    }

    /** Strictly higher confidence wins; equal confidence falls back to the cautionary priority. */
    static Judgment resolveContradiction(Judgment j1, Judgment j2) {
        int cmp = Double.compare(j1.confidence(), j2.confidence());
        if (cmp > 0) return j1;
        if (cmp < 0) return j2;
        return Verdict.mostCautious(j1.verdict(), j2.verdict()) == j1.verdict() ? j1 : j2;
    }

    private static Judgment higherConfidence(Judgment j1, Judgment j2) {
        return j2.confidence() > j1.confidence() ? j2 : j1;
    }

    private ConsensusResult build(Verdict verdict, double confidence, boolean agreement,
                                  List<Judgment> contributing, List<Finding> extra,
                                  Judgment lead) {
        List<Finding> merged = new ArrayList<>();
        for (Judgment j : contributing) {
            merged.addAll(j.findings());
        }
        merged.addAll(extra);

        String explanation = ExplanationComposer.compose(verdict, agreement, contributing, lead);
        MetadataAlignment alignment = MetadataAlignment.of(verdict, extra.size());
        return new ConsensusResult(verdict, confidence, agreement, contributing, merged, explanation, alignment);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
