package com.deepcheck.verification.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions ({@code /v1/chat/completions}) in JSON mode. Images are sent as
 * {@code data:} URLs; the answer is read from {@code choices[0].message.content}.
 */
@Component
@Order(2)
public class OpenAiClassifierAdapter extends RemoteClassifierAdapter {

    public static final String SOURCE = "openai";

    public OpenAiClassifierAdapter(WebClient.Builder builder,
                                   ObjectMapper objectMapper,
                                   JudgmentResponseParser parser,
                                   @Value("${classifiers.openai.base-url:https://api.openai.com}") String baseUrl,
                                   @Value("${classifiers.openai.model:gpt-4o-mini}") String model,
                                   @Value("${classifiers.openai.api-key:}") String apiKey) {
        super(builder, baseUrl, objectMapper, parser, model, apiKey);
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    protected String requestPath() {
        return "/v1/chat/completions";
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(apiKey);
    }

    @Override
    protected Map<String, Object> requestBody(Artifact artifact) {
        List<Map<String, Object>> messages;
        if (artifact.isClaim()) {
            messages = List.of(
                Map.of("role", "system", "content", ClassifierPrompts.FACT_CHECK_SYSTEM),
                Map.of("role", "user", "content", ClassifierPrompts.factCheck(artifact.text())));
        } else {
            String mime = artifact.mimeType() == null ? "image/jpeg" : artifact.mimeType();
            String dataUrl = "data:" + mime + ";base64," + Base64.getEncoder().encodeToString(artifact.bytes());
            messages = List.of(Map.of("role", "user", "content", List.of(
                Map.of("type", "text", "text", ClassifierPrompts.MEDIA_FORENSICS),
                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl)))));
        }
        return Map.of(
            "model", model,
            "messages", messages,
            "temperature", 0.2,
            "response_format", Map.of("type", "json_object"));
    }

    @Override
    protected Map<String, Object> textRequestBody(String prompt) {
        return Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "system", "content", ClassifierPrompts.EXPLAINER_SYSTEM),
                Map.of("role", "user", "content", prompt)),
            "temperature", 0.4,
            "response_format", Map.of("type", "json_object"));
    }

    @Override
    protected String extractText(JsonNode envelope) {
        return envelope.path("choices").path(0).path("message").path("content").asText(null);
    }
}
