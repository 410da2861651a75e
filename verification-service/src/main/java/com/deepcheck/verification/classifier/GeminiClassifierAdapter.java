package com.deepcheck.verification.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini via the Generative Language REST API ({@code models/{model}:generateContent}).
 * Images travel inline as base64 parts next to the prompt; the JSON answer is read from
 * {@code candidates[0].content.parts[0].text}.
 */
@Component
@Order(1)
public class GeminiClassifierAdapter extends RemoteClassifierAdapter {

    public static final String SOURCE = "gemini";

    public GeminiClassifierAdapter(WebClient.Builder builder,
                                   ObjectMapper objectMapper,
                                   JudgmentResponseParser parser,
                                   @Value("${classifiers.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                                   @Value("${classifiers.gemini.model:gemini-2.5-flash}") String model,
                                   @Value("${classifiers.gemini.api-key:}") String apiKey) {
        super(builder, baseUrl, objectMapper, parser, model, apiKey);
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    protected String requestPath() {
        return "/v1beta/models/" + model + ":generateContent";
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.set("x-goog-api-key", apiKey);
    }

    @Override
    protected Map<String, Object> requestBody(Artifact artifact) {
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("text", ClassifierPrompts.forArtifact(artifact)));
        if (!artifact.isClaim()) {
            parts.add(Map.of("inline_data", Map.of(
                "mime_type", artifact.mimeType() == null ? "image/jpeg" : artifact.mimeType(),
                "data", Base64.getEncoder().encodeToString(artifact.bytes()))));
        }
        return Map.of(
            "contents", List.of(Map.of("role", "user", "parts", parts)),
            "generationConfig", Map.of(
                "temperature", 0.2,
                "responseMimeType", "application/json"));
    }

    @Override
    protected Map<String, Object> textRequestBody(String prompt) {
        return Map.of(
            "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))),
            "generationConfig", Map.of(
                "temperature", 0.4,
                "responseMimeType", "application/json"));
    }

    @Override
    protected String extractText(JsonNode envelope) {
        return envelope.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText(null);
    }
}
