package com.deepcheck.verification.explanation;

import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.explanation.AudienceExplanation;
import com.deepcheck.common.explanation.AudienceLevel;
import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.verification.classifier.ClassifierAdapter;
import com.deepcheck.verification.classifier.JudgmentResponseParser;
import com.deepcheck.verification.config.PipelineSettings;
import com.deepcheck.verification.service.ClassifierDispatchService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-tells a claim verdict for an {@link AudienceLevel}.
 *
 * <p>Adapters are asked in registration order; the first usable answer wins. An adapter that
 * fails, times out or answers without a title and summary is skipped. When none answers the
 * template {@link AudienceExplanation#fallback} is returned, so this service never errors.
 */
@Service
public class ClaimExplanationService {

    private static final Logger log = LoggerFactory.getLogger(ClaimExplanationService.class);

    static final int MAX_CITATIONS = 3;

    private final List<ClassifierAdapter> adapters;
    private final ObjectMapper objectMapper;
    private final PipelineSettings settings;

    public ClaimExplanationService(ClassifierDispatchService dispatcher, ObjectMapper objectMapper,
                                   PipelineSettings settings) {
        this.adapters = dispatcher.adapters();
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public Mono<AudienceExplanation> explain(String claim, ConsensusResult result, AudienceLevel level) {
        List<String> citations = citations(result);
        String prompt = ExplanationPrompts.forLevel(level, claim, result.finalVerdict().name(),
            result.finalConfidence(), rationale(result), evidence(result));

        return Flux.fromIterable(adapters)
            .concatMap(adapter -> adapter.generateText(prompt)
                .timeout(settings.callTimeout())
                .map(text -> parse(adapter.sourceName(), text, level, citations))
                .onErrorResume(e -> {
                    log.warn("[Explanation] {} could not explain for {}. reason={}",
                             adapter.sourceName(), level, e.getMessage());
                    return Mono.empty();
                }))
            .next()
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.info("[Explanation] using template explanation for {}", level);
                return AudienceExplanation.fallback(level, result.finalVerdict(), result.finalConfidence(),
                                                    rationale(result), citations);
            }));
    }

    AudienceExplanation parse(String source, String text, AudienceLevel level, List<String> citations) {
        JsonNode json;
        try {
            json = objectMapper.readTree(JudgmentResponseParser.stripToJson(text));
        } catch (JsonProcessingException e) {
            throw new ServiceException(source, "unparseable explanation", e);
        }
        if (json == null || !json.isObject()
                || json.path("title").asText("").isBlank()
                || json.path("summary").asText("").isBlank()) {
            throw new ServiceException(source, "explanation without title or summary");
        }
        List<String> keyPoints = new ArrayList<>();
        for (JsonNode point : json.path("key_points")) {
            if (!point.asText("").isBlank()) keyPoints.add(point.asText());
        }
        return new AudienceExplanation(
            level,
            json.path("title").asText(),
            json.path("summary").asText(),
            json.path("detailed_explanation").asText(""),
            keyPoints,
            citations,
            json.path("what_to_do").asText(""),
            json.path("what_to_avoid").asText(""),
            source);
    }

    private static List<String> citations(ConsensusResult result) {
        return result.mergedFindings().stream()
            .filter(f -> Finding.SUPPORTING_EVIDENCE.equals(f.kind()))
            .map(Finding::description)
            .limit(MAX_CITATIONS)
            .toList();
    }

    private static List<String> evidence(ConsensusResult result) {
        return result.mergedFindings().stream()
            .filter(f -> Finding.SUPPORTING_EVIDENCE.equals(f.kind())
                      || Finding.CONTRADICTING_EVIDENCE.equals(f.kind()))
            .map(f -> (Finding.SUPPORTING_EVIDENCE.equals(f.kind()) ? "for: " : "against: ") + f.description())
            .toList();
    }

    /** Rationale of the strongest contributing judgment. */
    private static String rationale(ConsensusResult result) {
        return result.contributingJudgments().stream()
            .reduce((a, b) -> b.confidence() > a.confidence() ? b : a)
            .map(Judgment::rationale)
            .orElse("");
    }
}
