package com.deepcheck.common.aggregation;

import com.deepcheck.common.model.Judgment;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of {@link FrameAggregator#aggregate}: the synthesized media-level judgment plus the
 * per-frame trail it was reduced from (kept for persistence and audit).
 */
public record FrameAggregate(
    @JsonProperty("judgment")       Judgment judgment,
    @JsonProperty("frames")         List<FrameJudgment> frames,
    @JsonProperty("verdictChanges") int verdictChanges
) {
    public FrameAggregate {
        frames = List.copyOf(frames);
    }
}
