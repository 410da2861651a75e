package com.deepcheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Normalized output of one classifier call for one artifact.
 *
 * <p>Immutable: {@code findings} is copied into an unmodifiable list on construction.
 * {@code source} names the adapter that produced the judgment and is carried only for audit;
 * the consensus arithmetic never looks at it.
 */
public record Judgment(
    @JsonProperty("source")     String source,
    @JsonProperty("verdict")    Verdict verdict,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("rationale")  String rationale,
    @JsonProperty("findings")   List<Finding> findings
) {
    public Judgment {
        Objects.requireNonNull(verdict, "verdict");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1] but was " + confidence);
        }
        source    = source == null ? "unknown" : source;
        rationale = rationale == null ? "" : rationale;
        findings  = findings == null ? List.of() : List.copyOf(findings);
    }

    public static Judgment of(String source, Verdict verdict, double confidence,
                              String rationale, List<Finding> findings) {
        return new Judgment(source, verdict, confidence, rationale, findings);
    }
}
