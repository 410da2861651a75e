package com.deepcheck.common.model;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /** Lenient parse for classifier output; anything unrecognised is {@link #MEDIUM}. */
    public static Severity parse(String label) {
        if (label == null) return MEDIUM;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "low"              -> LOW;
            case "high", "critical" -> HIGH;
            default                 -> MEDIUM;
        };
    }
}
