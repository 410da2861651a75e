package com.deepcheck.verification.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Accepted upload types, keyed by lower-case file extension. */
public enum MediaKind {
    IMAGE,
    VIDEO;

    private static final Map<String, String> IMAGE_TYPES = Map.of(
        "jpg",  "image/jpeg",
        "jpeg", "image/jpeg",
        "png",  "image/png");

    private static final Map<String, String> VIDEO_TYPES = Map.of(
        "mp4",  "video/mp4",
        "avi",  "video/x-msvideo",
        "mov",  "video/quicktime",
        "webm", "video/webm");

    public static Optional<MediaKind> fromFilename(String filename) {
        String ext = extension(filename);
        if (IMAGE_TYPES.containsKey(ext)) return Optional.of(IMAGE);
        if (VIDEO_TYPES.containsKey(ext)) return Optional.of(VIDEO);
        return Optional.empty();
    }

    public static String mimeType(String filename) {
        String ext = extension(filename);
        return IMAGE_TYPES.getOrDefault(ext, VIDEO_TYPES.getOrDefault(ext, "application/octet-stream"));
    }

    static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
