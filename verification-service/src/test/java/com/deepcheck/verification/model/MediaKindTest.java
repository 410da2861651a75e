package com.deepcheck.verification.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MediaKindTest {

    @Test
    @DisplayName("extensions are matched case-insensitively")
    void fromFilename() {
        assertEquals(Optional.of(MediaKind.IMAGE), MediaKind.fromFilename("holiday.JPG"));
        assertEquals(Optional.of(MediaKind.IMAGE), MediaKind.fromFilename("scan.png"));
        assertEquals(Optional.of(MediaKind.VIDEO), MediaKind.fromFilename("speech.final.webm"));
        assertEquals(Optional.of(MediaKind.VIDEO), MediaKind.fromFilename("clip.mov"));
    }

    @Test
    @DisplayName("unsupported or missing extensions are rejected")
    void unsupported() {
        assertTrue(MediaKind.fromFilename("animation.gif").isEmpty());
        assertTrue(MediaKind.fromFilename("README").isEmpty());
        assertTrue(MediaKind.fromFilename(null).isEmpty());
    }

    @Test
    @DisplayName("mime type follows the extension")
    void mimeType() {
        assertEquals("image/jpeg", MediaKind.mimeType("a.jpeg"));
        assertEquals("video/quicktime", MediaKind.mimeType("a.mov"));
        assertEquals("application/octet-stream", MediaKind.mimeType("a.bin"));
    }
}
