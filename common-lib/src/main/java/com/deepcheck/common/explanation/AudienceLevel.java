package com.deepcheck.common.explanation;

import java.util.Locale;

/**
 * Reader an {@link AudienceExplanation} is written for.
 *
 * <pre>
 *   SIMPLE   everyday language, no jargon
 *   GENERAL  informed public, evidence and context (default)
 *   EXPERT   methodology, confidence and limitations
 * </pre>
 */
public enum AudienceLevel {
    SIMPLE,
    GENERAL,
    EXPERT;

    /** Lenient lookup: blank or unknown labels resolve to {@link #GENERAL}. */
    public static AudienceLevel parse(String label) {
        if (label == null || label.isBlank()) return GENERAL;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERAL;
        }
    }
}
