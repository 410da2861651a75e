package com.deepcheck.common.credibility;

import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Verdict;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Credibility of a verified claim in [0.0, 1.0], rounded to two decimals.
 *
 * <pre>
 *   base        = TRUE 0.9 | FALSE 0.1 | UNCERTAIN 0.3
 *   credibility = base × confidence
 *   if supporting + contradicting &gt; 0:
 *       credibility = (credibility + supporting / (supporting + contradicting)) / 2
 * </pre>
 * {@code supporting} and {@code contradicting} count the {@link Finding#SUPPORTING_EVIDENCE}
 * and {@link Finding#CONTRADICTING_EVIDENCE} findings of the consensus.
 */
public final class CredibilityScorer {

    static final double TRUE_BASE      = 0.9;
    static final double FALSE_BASE     = 0.1;
    static final double UNCERTAIN_BASE = 0.3;

    private CredibilityScorer() {}

    public static double score(ConsensusResult result) {
        List<Finding> findings = result.mergedFindings();
        long supporting = findings.stream().filter(f -> Finding.SUPPORTING_EVIDENCE.equals(f.kind())).count();
        long contradicting = findings.stream().filter(f -> Finding.CONTRADICTING_EVIDENCE.equals(f.kind())).count();
        return score(result.finalVerdict(), result.finalConfidence(), supporting, contradicting);
    }

    public static double score(Verdict verdict, double confidence, long supporting, long contradicting) {
        if (verdict == Verdict.AUTHENTIC || verdict == Verdict.MANIPULATED) {
            throw new IllegalArgumentException("credibility applies to claim verdicts only, got " + verdict);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1] but was " + confidence);
        }
        if (supporting < 0 || contradicting < 0) {
            throw new IllegalArgumentException("evidence counts must not be negative");
        }

        double credibility = base(verdict) * confidence;
        long evidence = supporting + contradicting;
        if (evidence > 0) {
            credibility = (credibility + (double) supporting / evidence) / 2;
        }
        return BigDecimal.valueOf(credibility).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static double base(Verdict verdict) {
        return switch (verdict) {
            case TRUE -> TRUE_BASE;
            case FALSE -> FALSE_BASE;
            default -> UNCERTAIN_BASE;
        };
    }
}
