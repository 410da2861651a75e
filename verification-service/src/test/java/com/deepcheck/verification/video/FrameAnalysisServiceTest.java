package com.deepcheck.verification.video;

import com.deepcheck.common.aggregation.FrameAggregator;
import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Verdict;
import com.deepcheck.verification.classifier.ScriptedClassifierAdapter;
import com.deepcheck.verification.config.PipelineSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrameAnalysisServiceTest {

    private static List<SampledFrame> frames(int count) {
        List<SampledFrame> frames = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            frames.add(new SampledFrame(i, Duration.ofSeconds(i * 2L), new byte[]{(byte) i}));
        }
        return frames;
    }

    private static int frameIndex(byte[] bytes) {
        return bytes[0];
    }

    private final FrameAnalysisService service = new FrameAnalysisService(
        new FrameAggregator(), new PipelineSettings(Duration.ofMillis(300), 5, 2));

    @Test
    @DisplayName("majority over five frames keeps timestamp order even when calls finish out of order")
    void majority() {
        Map<Integer, Verdict> script = Map.of(
            0, Verdict.MANIPULATED, 1, Verdict.MANIPULATED, 2, Verdict.AUTHENTIC,
            3, Verdict.MANIPULATED, 4, Verdict.AUTHENTIC);
        ScriptedClassifierAdapter adapter = new ScriptedClassifierAdapter("gemini", artifact -> {
            int i = frameIndex(artifact.bytes());
            Judgment j = ScriptedClassifierAdapter.judgment("gemini", script.get(i), 0.6 + i * 0.05);
            return Mono.delay(Duration.ofMillis(50L * (5 - i))).thenReturn(j);
        });

        StepVerifier.create(service.analyze(adapter, frames(5)))
            .assertNext(aggregate -> {
                assertEquals(Verdict.MANIPULATED, aggregate.judgment().verdict());
                assertEquals("gemini", aggregate.judgment().source());
                assertEquals(5, aggregate.frames().size());
                for (int i = 0; i < 5; i++) {
                    assertEquals(i, aggregate.frames().get(i).index());
                }
                // mean of frames 0, 1 and 3
                assertEquals((0.60 + 0.65 + 0.75) / 3, aggregate.judgment().confidence(), 1e-9);
            })
            .verifyComplete();
        assertEquals(5, adapter.calls());
    }

    @Test
    @DisplayName("failed and timed-out frames are dropped")
    void partialFailure() {
        ScriptedClassifierAdapter adapter = new ScriptedClassifierAdapter("openai", artifact -> {
            int i = frameIndex(artifact.bytes());
            if (i == 1) return Mono.error(new ServiceException("openai", "HTTP 500"));
            if (i == 2) return Mono.delay(Duration.ofSeconds(5)).thenReturn(
                ScriptedClassifierAdapter.judgment("openai", Verdict.MANIPULATED, 0.9));
            return Mono.just(ScriptedClassifierAdapter.judgment("openai", Verdict.AUTHENTIC, 0.8));
        });

        StepVerifier.create(service.analyze(adapter, frames(5)))
            .assertNext(aggregate -> {
                assertEquals(3, aggregate.frames().size());
                assertEquals(Verdict.AUTHENTIC, aggregate.judgment().verdict());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("every frame failing is a ServiceException for the adapter")
    void allFailed() {
        ScriptedClassifierAdapter adapter =
            ScriptedClassifierAdapter.failing("openai", new ServiceException("openai", "HTTP 503"));

        StepVerifier.create(service.analyze(adapter, frames(3)))
            .expectErrorSatisfies(e -> {
                ServiceException se = assertInstanceOf(ServiceException.class, e);
                assertTrue(se.getMessage().contains("all 3 frame evaluations failed"), se.getMessage());
            })
            .verify();
    }
}
