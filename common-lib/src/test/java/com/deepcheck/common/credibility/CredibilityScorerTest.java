package com.deepcheck.common.credibility;

import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.consensus.DualSourceConsensusStrategy;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Severity;
import com.deepcheck.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CredibilityScorerTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("verdict and confidence only")
    class WithoutEvidence {

        @Test
        @DisplayName("TRUE 0.8 → 0.9 × 0.8 = 0.72")
        void trueClaim() {
            assertEquals(0.72, CredibilityScorer.score(Verdict.TRUE, 0.8, 0, 0), EPS);
        }

        @Test
        @DisplayName("FALSE 0.9 → 0.1 × 0.9 = 0.09")
        void falseClaim() {
            assertEquals(0.09, CredibilityScorer.score(Verdict.FALSE, 0.9, 0, 0), EPS);
        }

        @Test
        @DisplayName("UNCERTAIN 0.5 → 0.3 × 0.5 = 0.15")
        void uncertainClaim() {
            assertEquals(0.15, CredibilityScorer.score(Verdict.UNCERTAIN, 0.5, 0, 0), EPS);
        }

        @Test
        @DisplayName("zero confidence scores zero")
        void zeroConfidence() {
            assertEquals(0.0, CredibilityScorer.score(Verdict.TRUE, 0.0, 0, 0), EPS);
        }
    }

    @Nested
    @DisplayName("evidence balance")
    class WithEvidence {

        @Test
        @DisplayName("TRUE 0.8 with 3 for, 1 against → (0.72 + 0.75) / 2 = 0.735 → 0.74")
        void balanceIsAveragedIn() {
            assertEquals(0.74, CredibilityScorer.score(Verdict.TRUE, 0.8, 3, 1), EPS);
        }

        @Test
        @DisplayName("FALSE 0.9 with only contradicting evidence → 0.09 / 2 → 0.05")
        void onlyContradicting() {
            assertEquals(0.05, CredibilityScorer.score(Verdict.FALSE, 0.9, 0, 2), EPS);
        }

        @Test
        @DisplayName("counts are read from the consensus findings")
        void fromConsensus() {
            Judgment gemini = Judgment.of("gemini", Verdict.TRUE, 0.8, "", List.of(
                Finding.of(Finding.SUPPORTING_EVIDENCE, "archive photo", Severity.LOW),
                Finding.of(Finding.SUPPORTING_EVIDENCE, "official record", Severity.LOW)));
            Judgment openai = Judgment.of("openai", Verdict.TRUE, 0.8, "", List.of(
                Finding.of(Finding.CONTRADICTING_EVIDENCE, "later renovation date", Severity.MEDIUM),
                Finding.of("visual_artifact", "ignored", Severity.MEDIUM)));
            ConsensusResult result = new DualSourceConsensusStrategy().compute(List.of(gemini, openai));

            // confidence 0.85 → 0.765; 2 of 3 supporting → (0.765 + 0.6667) / 2 = 0.7158
            assertEquals(0.72, CredibilityScorer.score(result), EPS);
        }
    }

    @Test
    @DisplayName("media verdicts and out-of-range inputs are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> CredibilityScorer.score(Verdict.AUTHENTIC, 0.5, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> CredibilityScorer.score(Verdict.MANIPULATED, 0.5, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> CredibilityScorer.score(Verdict.TRUE, 1.5, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> CredibilityScorer.score(Verdict.TRUE, 0.5, -1, 0));
    }
}
