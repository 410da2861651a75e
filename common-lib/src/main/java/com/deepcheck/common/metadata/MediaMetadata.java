package com.deepcheck.common.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * File-level metadata extracted from an uploaded artifact.
 *
 * @param captureMetadataPresent true when the file embeds camera/capture metadata (EXIF or equivalent)
 * @param fields                 textual metadata fields by tag name (Software, Creator Tool, parameters, ...)
 * @param width                  pixel width, {@code null} when unknown
 * @param height                 pixel height, {@code null} when unknown
 * @param captureTime            original capture time, {@code null} when absent
 * @param modifiedTime           last modification time recorded in the file, {@code null} when absent
 */
public record MediaMetadata(
    @JsonProperty("captureMetadataPresent") boolean captureMetadataPresent,
    @JsonProperty("fields")                 Map<String, String> fields,
    @JsonProperty("width")                  Integer width,
    @JsonProperty("height")                 Integer height,
    @JsonProperty("captureTime")            Instant captureTime,
    @JsonProperty("modifiedTime")           Instant modifiedTime
) {
    public MediaMetadata {
        TreeMap<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (k != null && v != null) sorted.put(k, v);
            });
        }
        fields = Collections.unmodifiableMap(sorted);
    }

    /** Metadata of a file nothing could be read from. */
    public static MediaMetadata empty() {
        return new MediaMetadata(false, Map.of(), null, null, null, null);
    }

    public boolean hasDimensions() {
        return width != null && height != null && width > 0 && height > 0;
    }
}
