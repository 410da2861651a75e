package com.deepcheck.verification.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PipelineSettingsTest {

    @Test
    @DisplayName("fan-out is clamped to the frame count")
    void clampsFanOut() {
        PipelineSettings s = new PipelineSettings(Duration.ofSeconds(10), 3, 8);
        assertEquals(3, s.frameFanOut());
    }

    @Test
    @DisplayName("frame pass budget is one call timeout per wave plus one")
    void framePassTimeout() {
        assertEquals(Duration.ofSeconds(60), PipelineSettings.DEFAULTS.framePassTimeout());
        assertEquals(Duration.ofSeconds(40), new PipelineSettings(Duration.ofSeconds(10), 5, 2).framePassTimeout());
    }

    @Test
    @DisplayName("non-positive values are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(Duration.ZERO, 5, 5));
        assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(Duration.ofSeconds(1), 0, 5));
        assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(Duration.ofSeconds(1), 5, 0));
        assertThrows(NullPointerException.class, () -> new PipelineSettings(null, 5, 5));
        assertThrows(IllegalArgumentException.class,
            () -> new PipelineSettings(Duration.ofSeconds(1), 5, 5, Duration.ZERO));
    }

    @Test
    @DisplayName("sampling timeout defaults to five minutes")
    void samplingTimeoutDefault() {
        assertEquals(Duration.ofMinutes(5), PipelineSettings.DEFAULTS.samplingTimeout());
        assertEquals(Duration.ofSeconds(9),
            new PipelineSettings(Duration.ofSeconds(1), 5, 5, Duration.ofSeconds(9)).samplingTimeout());
    }
}
