package com.deepcheck.verification.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted lifecycle of one textual claim.
 *
 * consensus: JSON-serialised ConsensusResult (null until COMPLETED)
 * audienceExplanation: JSON-serialised AudienceExplanation for audienceLevel (null until COMPLETED)
 */
@Data
@NoArgsConstructor
@Table("claim_analysis")
public class ClaimAnalysis implements AnalysisRecord {

    @Id
    private Long id;

    private String text;

    private String sourceUrl;

    private String status;

    private String verdict;

    private Double confidence;

    private Boolean agreement;

    private String explanation;

    private String metadataAlignment;

    /** JSON-serialised {@code ConsensusResult} */
    private String consensus;

    private Double credibilityScore;

    private String audienceLevel;

    private String audienceExplanation;

    private String errorReason;

    private String failureKind;

    private String traceId;

    private LocalDateTime submittedAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Override
    public String kind() {
        return "claim";
    }
}
