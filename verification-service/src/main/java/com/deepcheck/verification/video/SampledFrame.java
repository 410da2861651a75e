package com.deepcheck.verification.video;

import java.time.Duration;

/**
 * One decoded frame, JPEG-encoded.
 *
 * @param index     position in the sampling plan (0-based)
 * @param timestamp offset from the start of the video
 */
public record SampledFrame(int index, Duration timestamp, byte[] jpeg) {

    public String label() {
        return "frame " + index + " @ " + timestamp;
    }
}
