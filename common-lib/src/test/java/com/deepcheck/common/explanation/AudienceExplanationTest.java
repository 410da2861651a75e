package com.deepcheck.common.explanation;

import com.deepcheck.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AudienceExplanationTest {

    @Test
    @DisplayName("audience labels are case-insensitive and default to GENERAL")
    void parseLevel() {
        assertEquals(AudienceLevel.SIMPLE, AudienceLevel.parse("simple"));
        assertEquals(AudienceLevel.EXPERT, AudienceLevel.parse(" Expert "));
        assertEquals(AudienceLevel.GENERAL, AudienceLevel.parse(null));
        assertEquals(AudienceLevel.GENERAL, AudienceLevel.parse(""));
        assertEquals(AudienceLevel.GENERAL, AudienceLevel.parse("toddler"));
    }

    @Test
    @DisplayName("fallback text is built from the verdict, confidence and rationale")
    void fallback() {
        AudienceExplanation e = AudienceExplanation.fallback(AudienceLevel.SIMPLE, Verdict.FALSE, 0.87,
            "No record supports it.", List.of("archive"));

        assertTrue(e.isFallback());
        assertEquals(AudienceLevel.SIMPLE, e.audienceLevel());
        assertEquals("Claim Verification: FALSE", e.title());
        assertEquals("This claim has been assessed as false with 87% confidence.", e.summary());
        assertEquals("No record supports it.", e.detailedExplanation());
        assertEquals(List.of("archive"), e.citations());
        assertEquals(AudienceExplanation.FALLBACK_WHAT_TO_DO, e.whatToDo());
        assertEquals(AudienceExplanation.FALLBACK_WHAT_TO_AVOID, e.whatToAvoid());
    }

    @Test
    @DisplayName("missing text fields become empty, not null")
    void normalisesNulls() {
        AudienceExplanation e = new AudienceExplanation(AudienceLevel.GENERAL, "t", "s",
            null, null, null, null, null, "gemini");

        assertFalse(e.isFallback());
        assertEquals("", e.detailedExplanation());
        assertEquals(List.of(), e.keyPoints());
        assertEquals(List.of(), e.citations());
    }
}
