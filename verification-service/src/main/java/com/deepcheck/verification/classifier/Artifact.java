package com.deepcheck.verification.classifier;

import com.deepcheck.common.model.Domain;

import java.util.Objects;

/**
 * One unit of work for a {@link ClassifierAdapter}: a textual claim, a still image or a
 * single decoded video frame.
 *
 * @param domain   {@code CLAIM} for text, {@code MEDIA} for images and frames
 * @param text     claim text, {@code null} for media
 * @param bytes    encoded image bytes, {@code null} for claims
 * @param mimeType MIME type of {@code bytes}, {@code null} for claims
 * @param label    short description used in log lines ("image", "frame 3 @ PT2.5S", "claim")
 */
public record Artifact(Domain domain, String text, byte[] bytes, String mimeType, String label) {

    public Artifact {
        Objects.requireNonNull(domain, "domain");
        if (domain == Domain.CLAIM && (text == null || text.isBlank())) {
            throw new IllegalArgumentException("claim artifact requires text");
        }
        if (domain == Domain.MEDIA && (bytes == null || bytes.length == 0)) {
            throw new IllegalArgumentException("media artifact requires bytes");
        }
    }

    public static Artifact claim(String text) {
        return new Artifact(Domain.CLAIM, text, null, null, "claim");
    }

    public static Artifact image(byte[] bytes, String mimeType) {
        return new Artifact(Domain.MEDIA, null, bytes, mimeType, "image");
    }

    public static Artifact frame(byte[] jpegBytes, String label) {
        return new Artifact(Domain.MEDIA, null, jpegBytes, "image/jpeg", label);
    }

    public boolean isClaim() {
        return domain == Domain.CLAIM;
    }
}
