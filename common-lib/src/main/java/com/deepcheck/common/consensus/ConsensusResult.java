package com.deepcheck.common.consensus;

import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.MetadataAlignment;
import com.deepcheck.common.model.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code finalVerdict}          reconciled verdict</li>
 *   <li>{@code finalConfidence}       calibrated confidence in [0.0, 1.0]</li>
 *   <li>{@code agreement}             true only when both contributing judgments carry the same verdict</li>
 *   <li>{@code contributingJudgments} the one or two judgments that were fused, in source order</li>
 *   <li>{@code mergedFindings}        first source's findings, then the second's, then supplementary ones</li>
 *   <li>{@code explanation}           human-readable summary</li>
 *   <li>{@code metadataAlignment}     how supplementary findings relate to the verdict</li>
 * </ul>
 *
 * <p>This record is pure data. Instances are only created by {@link ConsensusEngine} implementations.
 */
public record ConsensusResult(
    @JsonProperty("finalVerdict")          Verdict finalVerdict,
    @JsonProperty("finalConfidence")       double finalConfidence,
    @JsonProperty("agreement")             boolean agreement,
    @JsonProperty("contributingJudgments") List<Judgment> contributingJudgments,
    @JsonProperty("mergedFindings")        List<Finding> mergedFindings,
    @JsonProperty("explanation")           String explanation,
    @JsonProperty("metadataAlignment")     MetadataAlignment metadataAlignment
) {
    public ConsensusResult {
        contributingJudgments = List.copyOf(contributingJudgments);
        mergedFindings        = List.copyOf(mergedFindings);
    }

    public boolean degraded() {
        return contributingJudgments.size() == 1;
    }
}
