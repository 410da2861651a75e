package com.deepcheck.common.metadata;

import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataHeuristicScorerTest {

    private static List<String> kinds(List<Finding> findings) {
        return findings.stream().map(Finding::kind).toList();
    }

    private static MediaMetadata camera(Map<String, String> fields, Integer w, Integer h) {
        return new MediaMetadata(true, fields, w, h, null, null);
    }

    @Nested
    @DisplayName("individual rules")
    class RuleTests {

        @Test
        @DisplayName("clean camera photo → no findings")
        void cleanPhoto() {
            MediaMetadata meta = camera(Map.of("Make", "Canon", "Model", "EOS R6", "Software", "Adobe Lightroom"),
                6000, 4000);
            assertTrue(MetadataHeuristicScorer.score(meta).isEmpty());
        }

        @Test
        @DisplayName("no capture metadata → missing_exif MEDIUM")
        void missingExif() {
            List<Finding> findings = MetadataHeuristicScorer.score(
                new MediaMetadata(false, Map.of(), 1920, 1080, null, null));

            assertEquals(List.of(MetadataHeuristicScorer.MISSING_EXIF), kinds(findings));
            assertEquals(Severity.MEDIUM, findings.get(0).severity());
        }

        @Test
        @DisplayName("null metadata is scored like an empty file")
        void nullMetadata() {
            assertEquals(List.of(MetadataHeuristicScorer.MISSING_EXIF),
                kinds(MetadataHeuristicScorer.score(null)));
        }

        @Test
        @DisplayName("generator name in Software → ai_software_detected HIGH")
        void aiSoftware() {
            List<Finding> findings = MetadataHeuristicScorer.score(
                camera(Map.of("Software", "Midjourney v6"), 1456, 816));

            assertEquals(List.of(MetadataHeuristicScorer.AI_SOFTWARE_DETECTED), kinds(findings));
            assertEquals(Severity.HIGH, findings.get(0).severity());
            assertTrue(findings.get(0).description().contains("Software"));
        }

        @Test
        @DisplayName("1024x1024 → suspicious_dimensions LOW")
        void generatorDimensions() {
            List<Finding> findings = MetadataHeuristicScorer.score(camera(Map.of(), 1024, 1024));

            assertEquals(List.of(MetadataHeuristicScorer.SUSPICIOUS_DIMENSIONS), kinds(findings));
            assertEquals(Severity.LOW, findings.get(0).severity());
        }

        @Test
        @DisplayName("aspect ratio beyond 4:1 → anomalous_aspect_ratio")
        void extremeAspectRatio() {
            assertEquals(List.of(MetadataHeuristicScorer.ANOMALOUS_ASPECT_RATIO),
                kinds(MetadataHeuristicScorer.score(camera(Map.of(), 5000, 1000))));
            assertTrue(MetadataHeuristicScorer.score(camera(Map.of(), 4000, 1000)).isEmpty());
        }

        @Test
        @DisplayName("modified before captured → timestamp_anomaly")
        void timestampAnomaly() {
            MediaMetadata meta = new MediaMetadata(true, Map.of(), 3000, 2000,
                Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2023-01-01T00:00:00Z"));

            assertEquals(List.of(MetadataHeuristicScorer.TIMESTAMP_ANOMALY),
                kinds(MetadataHeuristicScorer.score(meta)));
        }

        @Test
        @DisplayName("rules are additive and emitted in a fixed order")
        void additive() {
            MediaMetadata meta = new MediaMetadata(false, Map.of("Software", "Stable Diffusion"), 512, 512, null, null);

            assertEquals(List.of(
                MetadataHeuristicScorer.MISSING_EXIF,
                MetadataHeuristicScorer.AI_SOFTWARE_DETECTED,
                MetadataHeuristicScorer.SUSPICIOUS_DIMENSIONS), kinds(MetadataHeuristicScorer.score(meta)));
        }
    }

    @Nested
    @DisplayName("generator signatures")
    class SignatureTests {

        @Test
        @DisplayName("specific tool names match in any field")
        void toolNamesAnywhere() {
            assertTrue(MetadataHeuristicScorer.namesGenerator("Image Description", "made with DALL-E 3"));
            assertTrue(MetadataHeuristicScorer.namesGenerator("Comment", "ComfyUI workflow"));
        }

        @Test
        @DisplayName("Stable Diffusion web UI parameters chunk matches")
        void sdParameters() {
            assertTrue(MetadataHeuristicScorer.namesGenerator("parameters",
                "a castle at dusk\nSteps: 30, Sampler: DPM++ 2M, CFG scale: 7"));
        }

        @Test
        @DisplayName("generic wording only counts in software fields")
        void genericWordingScoped() {
            assertTrue(MetadataHeuristicScorer.namesGenerator("Software", "AI image generator"));
            assertFalse(MetadataHeuristicScorer.namesGenerator("Image Description", "AI conference keynote"));
            assertFalse(MetadataHeuristicScorer.namesGenerator("Software", "Paint.NET"));
        }
    }
}
