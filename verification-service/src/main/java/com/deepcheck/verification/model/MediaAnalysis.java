package com.deepcheck.verification.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted lifecycle of one uploaded image or video.
 *
 * Column mapping (R2DBC snake_case convention):
 *   storagePath       → storage_path
 *   mediaType         → media_type
 *   fileSize          → file_size
 *   userDescription   → user_description
 *   metadataAlignment → metadata_alignment
 *   metadataFindings  → metadata_findings
 *   frameAnalysis     → frame_analysis
 *   errorReason       → error_reason
 *   failureKind       → failure_kind
 *
 * consensus       : JSON-serialised ConsensusResult (null until COMPLETED)
 * metadataFindings: JSON-serialised List<Finding> from the metadata heuristics
 * frameAnalysis   : JSON-serialised List<FrameAggregate>, one per adapter (videos only)
 */
@Data
@NoArgsConstructor
@Table("media_analysis")
public class MediaAnalysis implements AnalysisRecord {

    @Id
    private Long id;

    private String filename;

    private String storagePath;

    /** {@link MediaKind} name */
    private String mediaType;

    private Long fileSize;

    private String userDescription;

    /** {@link com.deepcheck.common.model.AnalysisStatus} name */
    private String status;

    private String verdict;

    private Double confidence;

    private Boolean agreement;

    private String explanation;

    private String metadataAlignment;

    /** JSON-serialised {@code ConsensusResult} */
    private String consensus;

    /** JSON-serialised {@code List<Finding>} */
    private String metadataFindings;

    /** JSON-serialised {@code List<FrameAggregate>} */
    private String frameAnalysis;

    private String errorReason;

    private String failureKind;

    private String traceId;

    private LocalDateTime submittedAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Override
    public String kind() {
        return "media";
    }

    public MediaKind mediaKind() {
        return MediaKind.valueOf(mediaType);
    }
}
