package com.deepcheck.verification.service;

import com.deepcheck.common.aggregation.FrameAggregate;
import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.explanation.AudienceExplanation;
import com.deepcheck.common.model.Finding;
import com.deepcheck.verification.dto.VerificationResultDTO;
import com.deepcheck.verification.model.ClaimAnalysis;
import com.deepcheck.verification.model.JsonColumns;
import com.deepcheck.verification.model.MediaAnalysis;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entity → {@link VerificationResultDTO}. Decodes the JSON columns; never writes.
 */
@Component
public class AnalysisRecordMapper {

    private static final TypeReference<List<Finding>> FINDINGS = new TypeReference<>() {};
    private static final TypeReference<List<FrameAggregate>> FRAMES = new TypeReference<>() {};

    private final JsonColumns json;

    public AnalysisRecordMapper(JsonColumns json) {
        this.json = json;
    }

    public VerificationResultDTO toDto(MediaAnalysis m) {
        ConsensusResult consensus = json.read(m.getConsensus(), ConsensusResult.class);
        return new VerificationResultDTO(
            m.getId(), m.kind(), m.getStatus(),
            m.getVerdict(), m.getConfidence(), m.getAgreement(),
            consensus == null ? null : consensus.degraded(),
            m.getExplanation(),
            consensus == null ? null : consensus.mergedFindings(),
            m.getMetadataAlignment(),
            consensus == null ? null : consensus.contributingJudgments(),
            m.getErrorReason(), m.getFailureKind(), m.getTraceId(),
            m.getSubmittedAt(), m.getStartedAt(), m.getCompletedAt(),
            m.getFilename(), m.getMediaType(), m.getFileSize(), m.getUserDescription(),
            json.read(m.getMetadataFindings(), FINDINGS),
            json.read(m.getFrameAnalysis(), FRAMES),
            null, null, null, null, null);
    }

    public VerificationResultDTO toDto(ClaimAnalysis c) {
        ConsensusResult consensus = json.read(c.getConsensus(), ConsensusResult.class);
        return new VerificationResultDTO(
            c.getId(), c.kind(), c.getStatus(),
            c.getVerdict(), c.getConfidence(), c.getAgreement(),
            consensus == null ? null : consensus.degraded(),
            c.getExplanation(),
            consensus == null ? null : consensus.mergedFindings(),
            c.getMetadataAlignment(),
            consensus == null ? null : consensus.contributingJudgments(),
            c.getErrorReason(), c.getFailureKind(), c.getTraceId(),
            c.getSubmittedAt(), c.getStartedAt(), c.getCompletedAt(),
            null, null, null, null, null, null,
            c.getText(), c.getSourceUrl(),
            c.getCredibilityScore(), c.getAudienceLevel(),
            json.read(c.getAudienceExplanation(), AudienceExplanation.class));
    }
}
