package com.deepcheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One discrete piece of evidence: a visual artifact, a metadata anomaly, a piece of
 * supporting or contradicting evidence for a claim.
 *
 * <p>{@code kind} is a free-form tag such as {@code facial_inconsistency},
 * {@code missing_exif} or {@code temporal_inconsistency}.
 */
public record Finding(
    @JsonProperty("kind")        String kind,
    @JsonProperty("description") String description,
    @JsonProperty("severity")    Severity severity
) {
    /** Claim evidence kinds; the credibility score weighs their balance. */
    public static final String SUPPORTING_EVIDENCE    = "supporting_evidence";
    public static final String CONTRADICTING_EVIDENCE = "contradicting_evidence";

    public Finding {
        Objects.requireNonNull(kind, "kind");
        description = description == null ? "" : description;
        severity    = severity == null ? Severity.MEDIUM : severity;
    }

    public static Finding of(String kind, String description, Severity severity) {
        return new Finding(kind, description, severity);
    }
}
