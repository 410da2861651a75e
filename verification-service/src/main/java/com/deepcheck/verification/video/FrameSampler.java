package com.deepcheck.verification.video;

import java.nio.file.Path;

/**
 * Decodes a stored video into evenly spaced still frames. Implementations block and must be
 * called off the event loop.
 */
public interface FrameSampler {

    /**
     * @param video      path of the stored upload
     * @param frameCount K, the number of frames to take
     * @return the probe and exactly {@code frameCount} frames
     * @throws com.deepcheck.common.exception.DecodeException when the file cannot be probed or sliced
     */
    VideoSample sample(Path video, int frameCount);
}
