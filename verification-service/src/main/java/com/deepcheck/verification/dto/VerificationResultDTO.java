package com.deepcheck.verification.dto;

import com.deepcheck.common.aggregation.FrameAggregate;
import com.deepcheck.common.explanation.AudienceExplanation;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Public view of a media or claim analysis record.
 *
 * <p>Consensus fields are {@code null} until the record is {@code COMPLETED}; error fields are
 * {@code null} unless it is {@code FAILED}. Media-only and claim-only fields are omitted for the
 * other kind.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResultDTO(
    @JsonProperty("id")                Long id,
    @JsonProperty("kind")              String kind,
    @JsonProperty("status")            String status,
    @JsonProperty("verdict")           String verdict,
    @JsonProperty("confidence")        Double confidence,
    @JsonProperty("agreement")         Boolean agreement,
    @JsonProperty("degraded")          Boolean degraded,
    @JsonProperty("explanation")       String explanation,
    @JsonProperty("findings")          List<Finding> findings,
    @JsonProperty("metadataAlignment") String metadataAlignment,
    @JsonProperty("judgments")         List<Judgment> judgments,
    @JsonProperty("errorReason")       String errorReason,
    @JsonProperty("failureKind")       String failureKind,
    @JsonProperty("traceId")           String traceId,
    @JsonProperty("submittedAt")       LocalDateTime submittedAt,
    @JsonProperty("startedAt")         LocalDateTime startedAt,
    @JsonProperty("completedAt")       LocalDateTime completedAt,
    // media
    @JsonProperty("filename")          String filename,
    @JsonProperty("mediaType")         String mediaType,
    @JsonProperty("fileSize")          Long fileSize,
    @JsonProperty("userDescription")   String userDescription,
    @JsonProperty("metadataFindings")  List<Finding> metadataFindings,
    @JsonProperty("frameAnalysis")     List<FrameAggregate> frameAnalysis,
    // claim
    @JsonProperty("text")              String text,
    @JsonProperty("sourceUrl")         String sourceUrl,
    @JsonProperty("credibilityScore")  Double credibilityScore,
    @JsonProperty("audienceLevel")     String audienceLevel,
    @JsonProperty("audienceExplanation") AudienceExplanation audienceExplanation
) {}
