package com.deepcheck.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerdictTest {

    @Test
    @DisplayName("media labels map case-insensitively")
    void mediaLabels() {
        assertEquals(Verdict.AUTHENTIC, Verdict.parse(Domain.MEDIA, "real"));
        assertEquals(Verdict.AUTHENTIC, Verdict.parse(Domain.MEDIA, " Authentic "));
        assertEquals(Verdict.MANIPULATED, Verdict.parse(Domain.MEDIA, "FAKE"));
        assertEquals(Verdict.MANIPULATED, Verdict.parse(Domain.MEDIA, "deepfake"));
    }

    @Test
    @DisplayName("claim labels map to TRUE / FALSE, everything else abstains")
    void claimLabels() {
        assertEquals(Verdict.TRUE, Verdict.parse(Domain.CLAIM, "true"));
        assertEquals(Verdict.FALSE, Verdict.parse(Domain.CLAIM, "False"));
        assertEquals(Verdict.UNCERTAIN, Verdict.parse(Domain.CLAIM, "mixed"));
        assertEquals(Verdict.UNCERTAIN, Verdict.parse(Domain.CLAIM, "unverifiable"));
    }

    @Test
    @DisplayName("blank, null and cross-domain labels → UNCERTAIN")
    void abstentions() {
        assertEquals(Verdict.UNCERTAIN, Verdict.parse(Domain.MEDIA, null));
        assertEquals(Verdict.UNCERTAIN, Verdict.parse(Domain.MEDIA, "  "));
        assertEquals(Verdict.UNCERTAIN, Verdict.parse(Domain.MEDIA, "true"));
        assertEquals(Verdict.UNCERTAIN, Verdict.parse(Domain.CLAIM, "fake"));
    }

    @Test
    @DisplayName("cautionary priority: alarm > clearance > abstention")
    void mostCautious() {
        assertEquals(Verdict.MANIPULATED, Verdict.mostCautious(Verdict.AUTHENTIC, Verdict.MANIPULATED));
        assertEquals(Verdict.FALSE, Verdict.mostCautious(Verdict.FALSE, Verdict.TRUE));
        assertEquals(Verdict.TRUE, Verdict.mostCautious(Verdict.UNCERTAIN, Verdict.TRUE));
        assertEquals(Verdict.AUTHENTIC, Verdict.mostCautious(Verdict.AUTHENTIC, Verdict.AUTHENTIC));
    }

    @Test
    @DisplayName("judgment confidence outside [0,1] is rejected")
    void judgmentConfidenceRange() {
        assertThrows(IllegalArgumentException.class,
            () -> Judgment.of("gemini", Verdict.TRUE, 1.01, "", null));
        assertThrows(IllegalArgumentException.class,
            () -> Judgment.of("gemini", Verdict.TRUE, Double.NaN, "", null));
        assertTrue(Judgment.of(null, Verdict.TRUE, 0.0, null, null).findings().isEmpty());
    }
}
