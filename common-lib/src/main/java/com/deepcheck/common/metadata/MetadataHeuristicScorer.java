package com.deepcheck.common.metadata;

import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based signal extractor over file-level metadata. Pure, synchronous and deterministic.
 *
 * <p>Rules (independent and additive, emitted in this order):
 * <pre>
 *   missing_exif            MEDIUM  no embedded capture metadata
 *   ai_software_detected    HIGH    a metadata field names an AI generation tool (one per field)
 *   suspicious_dimensions   LOW     exact size commonly produced by image generators
 *   anomalous_aspect_ratio  LOW     aspect ratio outside 1:4 .. 4:1
 *   timestamp_anomaly       MEDIUM  file modified before it was captured
 * </pre>
 *
 * <p>The scorer never produces a verdict or a confidence. Its findings are appended to the
 * consensus findings and do not participate in the confidence arithmetic.
 */
public final class MetadataHeuristicScorer {

    public static final String MISSING_EXIF           = "missing_exif";
    public static final String AI_SOFTWARE_DETECTED   = "ai_software_detected";
    public static final String SUSPICIOUS_DIMENSIONS  = "suspicious_dimensions";
    public static final String ANOMALOUS_ASPECT_RATIO = "anomalous_aspect_ratio";
    public static final String TIMESTAMP_ANOMALY      = "timestamp_anomaly";

    static final double MAX_ASPECT_RATIO = 4.0;

    /** Tool names specific enough to match in any metadata field. */
    private static final Pattern TOOL_SIGNATURE = Pattern.compile(
        "midjourney|stable[ -]?diffusion|dall[-·]?e|firefly|novelai|comfyui|automatic1111|leonardo\\.ai|dreamstudio",
        Pattern.CASE_INSENSITIVE);

    /** Generic wording, only trusted inside fields that name the producing software. */
    private static final Pattern GENERIC_SIGNATURE = Pattern.compile(
        "\\bai\\b|\\bgenerated\\b|\\bai[- ]generated\\b|\\bdiffusion\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Set<String> SOFTWARE_FIELDS = Set.of(
        "software", "creator tool", "creatortool", "generator", "processing software", "producer");

    /** Sizes commonly emitted by image generators, width x height. */
    private static final Set<String> GENERATOR_SIZES = Set.of(
        "512x512", "768x768", "1024x1024", "1024x768", "768x1024", "2048x2048");

    private MetadataHeuristicScorer() {}

    public static List<Finding> score(MediaMetadata metadata) {
        if (metadata == null) {
            metadata = MediaMetadata.empty();
        }
        List<Finding> findings = new ArrayList<>();

        if (!metadata.captureMetadataPresent()) {
            findings.add(Finding.of(MISSING_EXIF,
                "No embedded capture metadata found; may indicate re-encoding or synthetic origin",
                Severity.MEDIUM));
        }

        for (Map.Entry<String, String> field : metadata.fields().entrySet()) {
            if (namesGenerator(field.getKey(), field.getValue())) {
                findings.add(Finding.of(AI_SOFTWARE_DETECTED,
                    "AI generation software signature in " + field.getKey() + ": " + abbreviate(field.getValue()),
                    Severity.HIGH));
            }
        }

        if (metadata.hasDimensions()) {
            int w = metadata.width();
            int h = metadata.height();
            if (GENERATOR_SIZES.contains(w + "x" + h)) {
                findings.add(Finding.of(SUSPICIOUS_DIMENSIONS,
                    "Image size " + w + "x" + h + " matches common AI generation dimensions",
                    Severity.LOW));
            }
            double ratio = (double) Math.max(w, h) / Math.min(w, h);
            if (ratio > MAX_ASPECT_RATIO) {
                findings.add(Finding.of(ANOMALOUS_ASPECT_RATIO,
                    String.format(Locale.ROOT, "Aspect ratio %.2f:1 is outside the expected range", ratio),
                    Severity.LOW));
            }
        }

        if (metadata.captureTime() != null && metadata.modifiedTime() != null
                && metadata.modifiedTime().isBefore(metadata.captureTime())) {
            findings.add(Finding.of(TIMESTAMP_ANOMALY,
                "Modification time " + metadata.modifiedTime() + " precedes capture time " + metadata.captureTime(),
                Severity.MEDIUM));
        }

        return findings;
    }

    static boolean namesGenerator(String field, String value) {
        if (value == null || value.isBlank()) return false;
        if (TOOL_SIGNATURE.matcher(value).find()) return true;
        // Stable Diffusion web UIs write their generation settings into a PNG "parameters" chunk
        if ("parameters".equalsIgnoreCase(field) && value.contains("Steps:") && value.contains("Sampler:")) {
            return true;
        }
        return SOFTWARE_FIELDS.contains(field.toLowerCase(Locale.ROOT))
            && GENERIC_SIGNATURE.matcher(value).find();
    }

    private static String abbreviate(String value) {
        String flat = value.replaceAll("\\s+", " ").trim();
        return flat.length() <= 80 ? flat : flat.substring(0, 77) + "...";
    }
}
