package com.deepcheck.verification.classifier;

import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.model.Judgment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Shared HTTP plumbing for adapters that call a hosted model over JSON.
 *
 * <p>Subclasses describe the provider's request path, body and response envelope; this class
 * owns the call itself: serialisation, status handling, envelope unwrapping and the mapping of
 * every failure onto {@link ServiceException}. Fully non-blocking; there is no {@code .block()}.
 */
public abstract class RemoteClassifierAdapter implements ClassifierAdapter {

    private static final Logger log = LoggerFactory.getLogger(RemoteClassifierAdapter.class);

    protected final WebClient client;
    protected final ObjectMapper objectMapper;
    protected final JudgmentResponseParser parser;
    protected final String model;
    protected final String apiKey;

    protected RemoteClassifierAdapter(WebClient.Builder builder, String baseUrl, ObjectMapper objectMapper,
                                      JudgmentResponseParser parser, String model, String apiKey) {
        this.client = builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.parser = parser;
        this.model = model;
        this.apiKey = apiKey;
    }

    /** Path (relative to the base URL) the request is posted to. */
    protected abstract String requestPath();

    /** Provider-specific authentication and routing headers. */
    protected abstract void applyHeaders(HttpHeaders headers);

    /** Provider-specific request body for {@code artifact}. */
    protected abstract Map<String, Object> requestBody(Artifact artifact);

    /** Provider-specific request body for a text-only prompt expecting a JSON answer. */
    protected abstract Map<String, Object> textRequestBody(String prompt);

    /** Extracts the model's text answer from the provider's response envelope. */
    protected abstract String extractText(JsonNode envelope);

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<Judgment> evaluate(Artifact artifact) {
        return call(requestBody(artifact), artifact.label())
            .map(text -> parser.parse(sourceName(), artifact.domain(), text))
            .onErrorMap(e -> !(e instanceof ServiceException),
                        e -> new ServiceException(sourceName(), "unusable answer: " + e.getMessage(), e))
            .doOnSuccess(j -> log.info("[Classifier] {} judged {}. verdict={} confidence={}",
                                       sourceName(), artifact.label(), j.verdict(), j.confidence()));
    }

    @Override
    public Mono<String> generateText(String prompt) {
        return call(textRequestBody(prompt), "text prompt")
            .doOnSuccess(text -> log.info("[Classifier] {} answered text prompt. chars={}",
                                          sourceName(), text.length()));
    }

    private Mono<String> call(Map<String, Object> body, String label) {
        if (!isConfigured()) {
            return Mono.error(new ServiceException(sourceName(), "not configured: no API key"));
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(bodyJson ->
                client.post()
                    .uri(requestPath())
                    .headers(this::applyHeaders)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::statusError)
                    .bodyToMono(String.class)
            )
            .map(this::unwrapEnvelope)
            .onErrorMap(e -> !(e instanceof ServiceException),
                        e -> new ServiceException(sourceName(), "call failed: " + e.getMessage(), e))
            .doOnError(e -> log.warn("[Classifier] {} failed on {}. reason={}",
                                     sourceName(), label, e.getMessage()));
    }

    private Mono<Throwable> statusError(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        String what = status.value() == HttpStatus.TOO_MANY_REQUESTS.value()
            ? "quota exceeded (HTTP 429)"
            : "HTTP " + status.value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> new ServiceException(sourceName(), what + abbreviate(body)));
    }

    private String unwrapEnvelope(String response) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ServiceException(sourceName(), "malformed response envelope", e);
        }
        String text = extractText(envelope);
        if (text == null || text.isBlank()) {
            throw new ServiceException(sourceName(), "response carried no text");
        }
        return text;
    }

    private static String abbreviate(String body) {
        if (body.isBlank()) return "";
        String flat = body.replaceAll("\\s+", " ").trim();
        return ": " + (flat.length() <= 200 ? flat : flat.substring(0, 197) + "...");
    }
}
