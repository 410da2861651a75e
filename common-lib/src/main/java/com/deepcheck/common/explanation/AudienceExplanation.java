package com.deepcheck.common.explanation;

import com.deepcheck.common.model.Verdict;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A claim verdict re-told for one {@link AudienceLevel}.
 *
 * <p>{@code generatedBy} names the classifier service that wrote it, or is {@code null} for the
 * built-in {@link #fallback} text used when no service could.
 */
public record AudienceExplanation(
    @JsonProperty("audienceLevel")       AudienceLevel audienceLevel,
    @JsonProperty("title")               String title,
    @JsonProperty("summary")             String summary,
    @JsonProperty("detailedExplanation") String detailedExplanation,
    @JsonProperty("keyPoints")           List<String> keyPoints,
    @JsonProperty("citations")           List<String> citations,
    @JsonProperty("whatToDo")            String whatToDo,
    @JsonProperty("whatToAvoid")         String whatToAvoid,
    @JsonProperty("generatedBy")         String generatedBy
) {
    static final String FALLBACK_WHAT_TO_DO =
        "Verify information from multiple credible sources before sharing.";
    static final String FALLBACK_WHAT_TO_AVOID =
        "Avoid sharing unverified claims during crisis situations.";

    public AudienceExplanation {
        Objects.requireNonNull(audienceLevel, "audienceLevel");
        title               = title == null ? "" : title;
        summary             = summary == null ? "" : summary;
        detailedExplanation = detailedExplanation == null ? "" : detailedExplanation;
        keyPoints           = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        citations           = citations == null ? List.of() : List.copyOf(citations);
        whatToDo            = whatToDo == null ? "" : whatToDo;
        whatToAvoid         = whatToAvoid == null ? "" : whatToAvoid;
    }

    @JsonIgnore
    public boolean isFallback() {
        return generatedBy == null;
    }

    /** Template explanation built from the verdict alone. */
    public static AudienceExplanation fallback(AudienceLevel level, Verdict verdict, double confidence,
                                               String rationale, List<String> citations) {
        String label = verdict.name().toLowerCase(Locale.ROOT);
        return new AudienceExplanation(
            level,
            "Claim Verification: " + verdict.name(),
            String.format(Locale.ROOT, "This claim has been assessed as %s with %d%% confidence.",
                          label, Math.round(confidence * 100)),
            rationale,
            List.of(),
            citations,
            FALLBACK_WHAT_TO_DO,
            FALLBACK_WHAT_TO_AVOID,
            null);
    }
}
