package com.deepcheck.verification.explanation;

import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.consensus.DualSourceConsensusStrategy;
import com.deepcheck.common.explanation.AudienceExplanation;
import com.deepcheck.common.explanation.AudienceLevel;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Severity;
import com.deepcheck.common.model.Verdict;
import com.deepcheck.verification.classifier.ScriptedClassifierAdapter;
import com.deepcheck.verification.config.PipelineSettings;
import com.deepcheck.verification.service.ClassifierDispatchService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ClaimExplanationServiceTest {

    private static final String CLAIM = "Drinking sea water cures dehydration.";

    private static final String ANSWER = """
        ```json
        {"title": "Sea water makes dehydration worse",
         "summary": "Salt draws water out of the body.",
         "detailed_explanation": "Kidneys cannot excrete salt at sea-water concentration.",
         "what_to_do": "Drink fresh water.",
         "what_to_avoid": "Do not drink sea water.",
         "key_points": ["salt", "", "kidneys"]}
        ```
        """;

    private final ConsensusResult result = new DualSourceConsensusStrategy().compute(List.of(
        Judgment.of("gemini", Verdict.FALSE, 0.7, "gemini reasoning", List.of(
            Finding.of(Finding.SUPPORTING_EVIDENCE, "s1", Severity.LOW),
            Finding.of(Finding.SUPPORTING_EVIDENCE, "s2", Severity.LOW),
            Finding.of(Finding.CONTRADICTING_EVIDENCE, "c1", Severity.MEDIUM))),
        Judgment.of("openai", Verdict.FALSE, 0.9, "openai reasoning", List.of(
            Finding.of(Finding.SUPPORTING_EVIDENCE, "s3", Severity.LOW),
            Finding.of(Finding.SUPPORTING_EVIDENCE, "s4", Severity.LOW)))));

    private static ClaimExplanationService service(ScriptedClassifierAdapter first, ScriptedClassifierAdapter second,
                                                   Duration callTimeout) {
        return new ClaimExplanationService(new ClassifierDispatchService(List.of(first, second)),
            new ObjectMapper(), new PipelineSettings(callTimeout, 5, 5));
    }

    private static ScriptedClassifierAdapter adapter(String source) {
        return ScriptedClassifierAdapter.answering(source, Verdict.FALSE, 0.8);
    }

    @Nested
    @DisplayName("generated explanations")
    class Generated {

        @Test
        @DisplayName("the first adapter's answer is used and the second is never asked")
        void firstAdapterWins() {
            AtomicReference<String> prompt = new AtomicReference<>();
            ScriptedClassifierAdapter gemini = adapter("gemini").answeringText(p -> {
                prompt.set(p);
                return Mono.just(ANSWER);
            });
            ScriptedClassifierAdapter openai = adapter("openai").answeringText(p -> Mono.just(ANSWER));

            StepVerifier.create(service(gemini, openai, Duration.ofSeconds(2)).explain(CLAIM, result, AudienceLevel.SIMPLE))
                .assertNext(e -> {
                    assertEquals("gemini", e.generatedBy());
                    assertEquals(AudienceLevel.SIMPLE, e.audienceLevel());
                    assertEquals("Sea water makes dehydration worse", e.title());
                    assertEquals("Drink fresh water.", e.whatToDo());
                    assertEquals(List.of("salt", "kidneys"), e.keyPoints());
                    assertEquals(List.of("s1", "s2", "s3"), e.citations());
                })
                .verifyComplete();

            assertEquals(0, openai.textCalls());
            assertTrue(prompt.get().contains("CLAIM: " + CLAIM));
            assertTrue(prompt.get().contains("VERDICT: FALSE"));
            assertTrue(prompt.get().contains("REASONING: openai reasoning"));
            assertTrue(prompt.get().contains("8th grade"));
        }

        @Test
        @DisplayName("expert prompts list the evidence on both sides")
        void expertPromptCarriesEvidence() {
            AtomicReference<String> prompt = new AtomicReference<>();
            ScriptedClassifierAdapter gemini = adapter("gemini").answeringText(p -> {
                prompt.set(p);
                return Mono.just(ANSWER);
            });

            service(gemini, adapter("openai"), Duration.ofSeconds(2)).explain(CLAIM, result, AudienceLevel.EXPERT).block();

            assertTrue(prompt.get().contains("EVIDENCE: for: s1; for: s2; against: c1; for: s3; for: s4"), prompt.get());
        }

        @Test
        @DisplayName("an answer without a title is skipped in favour of the next adapter")
        void incompleteAnswerSkipped() {
            ScriptedClassifierAdapter gemini = adapter("gemini")
                .answeringText(p -> Mono.just("{\"summary\": \"no title here\"}"));
            ScriptedClassifierAdapter openai = adapter("openai").answeringText(p -> Mono.just(ANSWER));

            AudienceExplanation e = service(gemini, openai, Duration.ofSeconds(2))
                .explain(CLAIM, result, AudienceLevel.GENERAL).block();

            assertNotNull(e);
            assertEquals("openai", e.generatedBy());
        }
    }

    @Nested
    @DisplayName("fallback")
    class Fallback {

        @Test
        @DisplayName("adapters without text support yield the template explanation")
        void noTextSupport() {
            AudienceExplanation e = service(adapter("gemini"), adapter("openai"), Duration.ofSeconds(2))
                .explain(CLAIM, result, AudienceLevel.GENERAL).block();

            assertNotNull(e);
            assertTrue(e.isFallback());
            assertEquals("Claim Verification: FALSE", e.title());
            assertEquals("openai reasoning", e.detailedExplanation());
            assertEquals(List.of("s1", "s2", "s3"), e.citations());
        }

        @Test
        @DisplayName("a prose answer and a slow answer both fall back")
        void proseAndTimeout() {
            ScriptedClassifierAdapter gemini = adapter("gemini")
                .answeringText(p -> Mono.just("Sorry, I cannot help with that."));
            ScriptedClassifierAdapter openai = adapter("openai")
                .answeringText(p -> Mono.delay(Duration.ofSeconds(5)).thenReturn(ANSWER));

            StepVerifier.create(service(gemini, openai, Duration.ofMillis(100)).explain(CLAIM, result, AudienceLevel.EXPERT))
                .assertNext(e -> {
                    assertTrue(e.isFallback());
                    assertEquals(AudienceLevel.EXPERT, e.audienceLevel());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(3));
        }
    }
}
