package com.deepcheck.verification.video;

import java.util.List;

/** A probed video together with its K sampled frames in timestamp order. */
public record VideoSample(VideoProbe probe, List<SampledFrame> frames) {

    public VideoSample {
        frames = List.copyOf(frames);
    }
}
