package com.deepcheck.verification.video;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Container-level facts about a video as reported by the prober.
 *
 * @param duration     playback length
 * @param width        pixel width of the first video stream, {@code null} when unknown
 * @param height       pixel height of the first video stream, {@code null} when unknown
 * @param creationTime {@code creation_time} tag, {@code null} when absent
 * @param tags         container and stream tags (encoder, handler names, ...)
 */
public record VideoProbe(Duration duration, Integer width, Integer height, Instant creationTime,
                         Map<String, String> tags) {

    public VideoProbe {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
