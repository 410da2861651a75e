package com.deepcheck.verification.classifier;

import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.model.Domain;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Severity;
import com.deepcheck.common.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JudgmentResponseParserTest {

    private final JudgmentResponseParser parser = new JudgmentResponseParser(new ObjectMapper());

    @Nested
    @DisplayName("Media answers")
    class Media {

        @Test
        @DisplayName("fenced JSON with artifacts is parsed into a MANIPULATED judgment")
        void fencedJson() {
            String text = """
                Here is my analysis:
                ```json
                {
                  "verdict": "fake",
                  "confidence": 0.87,
                  "reasoning": "blending seams around the jaw",
                  "artifacts_detected": [
                    "unnatural skin texture",
                    {"kind": "facial_inconsistency", "description": "jaw seam", "severity": "high"}
                  ]
                }
                ```
                """;

            Judgment j = parser.parse("gemini", Domain.MEDIA, text);

            assertEquals("gemini", j.source());
            assertEquals(Verdict.MANIPULATED, j.verdict());
            assertEquals(0.87, j.confidence(), 1e-9);
            assertEquals("blending seams around the jaw", j.rationale());
            assertEquals(2, j.findings().size());
            assertEquals(Finding.of(JudgmentResponseParser.VISUAL_ARTIFACT, "unnatural skin texture", Severity.MEDIUM),
                         j.findings().get(0));
            assertEquals(Finding.of("facial_inconsistency", "jaw seam", Severity.HIGH), j.findings().get(1));
        }

        @Test
        @DisplayName("unknown verdict label is an abstention")
        void unknownVerdict() {
            Judgment j = parser.parse("openai", Domain.MEDIA, "{\"verdict\":\"probably\",\"confidence\":0.4}");
            assertEquals(Verdict.UNCERTAIN, j.verdict());
        }

        @Test
        @DisplayName("claim labels are not accepted for media")
        void crossDomainLabel() {
            Judgment j = parser.parse("openai", Domain.MEDIA, "{\"verdict\":\"true\",\"confidence\":0.9}");
            assertEquals(Verdict.UNCERTAIN, j.verdict());
        }
    }

    @Nested
    @DisplayName("Claim answers")
    class Claim {

        @Test
        @DisplayName("evidence lists become LOW and MEDIUM findings, blank entries skipped")
        void evidence() {
            String text = """
                {"verdict": "FALSE", "confidence": "0.75", "reasoning": "contradicted by records",
                 "supporting_evidence": ["one blog post", ""],
                 "contradicting_evidence": ["official census data"]}
                """;

            Judgment j = parser.parse("openai", Domain.CLAIM, text);

            assertEquals(Verdict.FALSE, j.verdict());
            assertEquals(0.75, j.confidence(), 1e-9);
            assertEquals(2, j.findings().size());
            assertEquals(JudgmentResponseParser.SUPPORTING_EVIDENCE, j.findings().get(0).kind());
            assertEquals(Severity.LOW, j.findings().get(0).severity());
            assertEquals(JudgmentResponseParser.CONTRADICTING_EVIDENCE, j.findings().get(1).kind());
            assertEquals(Severity.MEDIUM, j.findings().get(1).severity());
        }

        @Test
        @DisplayName("mixed and unverifiable map to UNCERTAIN")
        void mixed() {
            assertEquals(Verdict.UNCERTAIN,
                parser.parse("gemini", Domain.CLAIM, "{\"verdict\":\"mixed\"}").verdict());
            assertEquals(Verdict.UNCERTAIN,
                parser.parse("gemini", Domain.CLAIM, "{\"verdict\":\"unverifiable\"}").verdict());
        }
    }

    @Nested
    @DisplayName("Confidence")
    class Confidence {

        @Test
        @DisplayName("out-of-range values are clamped into [0,1]")
        void clamped() {
            assertEquals(1.0, parser.parse("g", Domain.MEDIA, "{\"verdict\":\"real\",\"confidence\":1.7}").confidence());
            assertEquals(0.0, parser.parse("g", Domain.MEDIA, "{\"verdict\":\"real\",\"confidence\":-2}").confidence());
        }

        @Test
        @DisplayName("missing or non-numeric confidence defaults to 0.5")
        void defaulted() {
            assertEquals(0.5, parser.parse("g", Domain.MEDIA, "{\"verdict\":\"real\"}").confidence());
            assertEquals(0.5, parser.parse("g", Domain.MEDIA, "{\"verdict\":\"real\",\"confidence\":\"high\"}").confidence());
        }
    }

    @Nested
    @DisplayName("Malformed answers")
    class Malformed {

        @Test
        @DisplayName("text without a JSON object is a ServiceException naming the source")
        void noJson() {
            ServiceException e = assertThrows(ServiceException.class,
                () -> parser.parse("gemini", Domain.MEDIA, "I cannot analyse this image."));
            assertEquals("gemini", e.getSource());
        }

        @Test
        @DisplayName("a JSON array is rejected")
        void array() {
            assertThrows(ServiceException.class, () -> parser.parse("gemini", Domain.MEDIA, "[1, 2]"));
        }

        @Test
        @DisplayName("stripToJson keeps only the outermost object")
        void strip() {
            assertEquals("{\"a\":{\"b\":1}}", JudgmentResponseParser.stripToJson("prefix {\"a\":{\"b\":1}} suffix"));
            assertEquals("", JudgmentResponseParser.stripToJson(null));
        }
    }
}
