package com.deepcheck.common.aggregation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Evenly spaced frame timestamps across a video: first and last frame included,
 * spacing {@code duration / (K − 1)}.
 */
public final class FramePlan {

    private FramePlan() {}

    public static List<Duration> timestamps(Duration duration, int frameCount) {
        if (frameCount < 1) {
            throw new IllegalArgumentException("frameCount must be positive but was " + frameCount);
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        List<Duration> timestamps = new ArrayList<>(frameCount);
        if (frameCount == 1) {
            timestamps.add(Duration.ZERO);
            return timestamps;
        }
        long totalNanos = duration.toNanos();
        for (int i = 0; i < frameCount; i++) {
            // integer math keeps the last timestamp exactly at the end of the video
            timestamps.add(Duration.ofNanos(Math.multiplyExact(totalNanos, (long) i) / (frameCount - 1)));
        }
        return timestamps;
    }
}
