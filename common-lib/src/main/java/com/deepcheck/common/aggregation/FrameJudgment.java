package com.deepcheck.common.aggregation;

import com.deepcheck.common.model.Judgment;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * A classifier judgment for one sampled video frame.
 *
 * @param index     position of the frame in the sampling plan (0-based)
 * @param timestamp offset of the frame from the start of the video
 */
public record FrameJudgment(
    @JsonProperty("index")     int index,
    @JsonProperty("timestamp") Duration timestamp,
    @JsonProperty("judgment")  Judgment judgment
) {}
