package com.deepcheck.verification.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime knobs of the analysis pipeline.
 *
 * <ul>
 *   <li>{@code callTimeout} upper bound for one classifier call (one artifact or one frame)</li>
 *   <li>{@code frameCount}  K, frames sampled per video</li>
 *   <li>{@code frameFanOut} concurrent frame evaluations per adapter, clamped to K</li>
 *   <li>{@code samplingTimeout} upper bound for probing a video and extracting its K frames</li>
 * </ul>
 */
public record PipelineSettings(Duration callTimeout, int frameCount, int frameFanOut, Duration samplingTimeout) {

    public static final Duration DEFAULT_SAMPLING_TIMEOUT = Duration.ofMinutes(5);

    public static final PipelineSettings DEFAULTS = new PipelineSettings(Duration.ofSeconds(30), 5, 5);

    public PipelineSettings {
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(samplingTimeout, "samplingTimeout");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive but was " + callTimeout);
        }
        if (samplingTimeout.isZero() || samplingTimeout.isNegative()) {
            throw new IllegalArgumentException("samplingTimeout must be positive but was " + samplingTimeout);
        }
        if (frameCount < 1) {
            throw new IllegalArgumentException("frameCount must be positive but was " + frameCount);
        }
        if (frameFanOut < 1) {
            throw new IllegalArgumentException("frameFanOut must be positive but was " + frameFanOut);
        }
        frameFanOut = Math.min(frameFanOut, frameCount);
    }

    public PipelineSettings(Duration callTimeout, int frameCount, int frameFanOut) {
        this(callTimeout, frameCount, frameFanOut, DEFAULT_SAMPLING_TIMEOUT);
    }

    /**
     * Upper bound for one adapter's whole frame pass: one call timeout per wave of
     * {@code frameFanOut} frames, plus one wave of slack.
     */
    public Duration framePassTimeout() {
        int waves = (frameCount + frameFanOut - 1) / frameFanOut;
        return callTimeout.multipliedBy(waves + 1L);
    }
}
