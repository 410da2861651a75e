package com.deepcheck.verification.model;

import com.deepcheck.common.model.AnalysisStatus;

import java.time.LocalDateTime;

/**
 * Lifecycle columns shared by {@link MediaAnalysis} and {@link ClaimAnalysis}, so that
 * {@link com.deepcheck.verification.lifecycle.AnalysisStateMachine} can drive either.
 */
public interface AnalysisRecord {

    Long getId();

    String getTraceId();

    String getStatus();
    void setStatus(String status);

    void setVerdict(String verdict);
    void setConfidence(Double confidence);
    void setAgreement(Boolean agreement);
    void setExplanation(String explanation);
    void setMetadataAlignment(String metadataAlignment);
    void setConsensus(String consensusJson);

    String getErrorReason();
    void setErrorReason(String errorReason);
    void setFailureKind(String failureKind);

    void setStartedAt(LocalDateTime startedAt);
    void setCompletedAt(LocalDateTime completedAt);

    default AnalysisStatus status() {
        return AnalysisStatus.valueOf(getStatus());
    }

    /** "media" or "claim", used in log lines and error messages. */
    String kind();
}
