package com.deepcheck.common.model;

/**
 * How supplementary metadata findings relate to the consensus verdict.
 * Informational only; it never changes the verdict or the confidence.
 */
public enum MetadataAlignment {
    /** No supplementary findings were supplied. */
    NONE,
    /** Findings present and the verdict raises an alarm (MANIPULATED / FALSE). */
    CORROBORATING,
    /** Findings present but the verdict clears the artifact (AUTHENTIC / TRUE). */
    CONTRADICTING,
    /** Findings present and the verdict is UNCERTAIN. */
    NEUTRAL;

    public static MetadataAlignment of(Verdict verdict, int supplementaryFindingCount) {
        if (supplementaryFindingCount == 0) return NONE;
        if (!verdict.isDecisive()) return NEUTRAL;
        return verdict.priority() == Verdict.MANIPULATED.priority() ? CORROBORATING : CONTRADICTING;
    }
}
