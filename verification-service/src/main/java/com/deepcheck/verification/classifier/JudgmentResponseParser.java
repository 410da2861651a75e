package com.deepcheck.verification.classifier;

import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.model.Domain;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Severity;
import com.deepcheck.common.model.Verdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the JSON answer of a classifier model into a {@link Judgment}.
 *
 * <p>Accepted shape (unknown fields ignored):
 * <pre>
 * {
 *   "verdict": "fake|real|uncertain|true|false|mixed|unverifiable",
 *   "confidence": 0.0 .. 1.0,
 *   "reasoning": "...",
 *   "artifacts_detected":     ["..." | {"kind", "description", "severity"}],
 *   "supporting_evidence":    ["..."],
 *   "contradicting_evidence": ["..."]
 * }
 * </pre>
 * Markdown code fences and prose around the object are tolerated. A missing or unknown
 * verdict is an abstention ({@code UNCERTAIN}); text that holds no JSON object at all is a
 * {@link ServiceException}.
 */
@Component
public class JudgmentResponseParser {

    static final String VISUAL_ARTIFACT        = "visual_artifact";
    static final String SUPPORTING_EVIDENCE    = Finding.SUPPORTING_EVIDENCE;
    static final String CONTRADICTING_EVIDENCE = Finding.CONTRADICTING_EVIDENCE;

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;

    public JudgmentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Judgment parse(String source, Domain domain, String responseText) {
        JsonNode json = readObject(source, responseText);

        Verdict verdict  = Verdict.parse(domain, json.path("verdict").asText(null));
        double confidence = confidence(json.path("confidence"));
        String reasoning  = json.path("reasoning").asText("");

        List<Finding> findings = new ArrayList<>();
        for (JsonNode artifact : json.path("artifacts_detected")) {
            findings.add(artifactFinding(artifact));
        }
        for (JsonNode evidence : json.path("supporting_evidence")) {
            addEvidence(findings, SUPPORTING_EVIDENCE, evidence, Severity.LOW);
        }
        for (JsonNode evidence : json.path("contradicting_evidence")) {
            addEvidence(findings, CONTRADICTING_EVIDENCE, evidence, Severity.MEDIUM);
        }
        return Judgment.of(source, verdict, confidence, reasoning, findings);
    }

    /** Removes Markdown fences and any prose before the first '{' or after the last '}'. */
    public static String stripToJson(String text) {
        if (text == null) return "";
        String cleaned = text;
        int fence = cleaned.indexOf("```json");
        if (fence >= 0) {
            cleaned = cleaned.substring(fence + "```json".length());
        } else if (cleaned.contains("```")) {
            cleaned = cleaned.substring(cleaned.indexOf("```") + 3);
        }
        int closing = cleaned.indexOf("```");
        if (closing >= 0) {
            cleaned = cleaned.substring(0, closing);
        }
        int start = cleaned.indexOf('{');
        int end   = cleaned.lastIndexOf('}');
        return start >= 0 && end > start ? cleaned.substring(start, end + 1) : cleaned.trim();
    }

    private JsonNode readObject(String source, String responseText) {
        String cleaned = stripToJson(responseText);
        try {
            JsonNode json = objectMapper.readTree(cleaned);
            if (json == null || !json.isObject()) {
                throw new ServiceException(source, "response is not a JSON object: " + abbreviate(responseText));
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new ServiceException(source, "unparseable response: " + abbreviate(responseText), e);
        }
    }

    private static double confidence(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) return DEFAULT_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Finding artifactFinding(JsonNode artifact) {
        if (artifact.isObject()) {
            String kind = artifact.hasNonNull("kind") ? artifact.get("kind").asText()
                        : artifact.path("type").asText(VISUAL_ARTIFACT);
            return Finding.of(kind, artifact.path("description").asText(""),
                              Severity.parse(artifact.path("severity").asText(null)));
        }
        return Finding.of(VISUAL_ARTIFACT, artifact.asText(), Severity.MEDIUM);
    }

    private static void addEvidence(List<Finding> findings, String kind, JsonNode evidence, Severity severity) {
        String text = evidence.isObject() ? evidence.path("text").asText("") : evidence.asText("");
        if (!text.isBlank()) {
            findings.add(Finding.of(kind, text, severity));
        }
    }

    private static String abbreviate(String text) {
        if (text == null) return "<empty>";
        return text.length() <= 120 ? text : text.substring(0, 117) + "...";
    }
}
