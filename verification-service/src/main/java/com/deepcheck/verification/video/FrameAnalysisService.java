package com.deepcheck.verification.video;

import com.deepcheck.common.aggregation.FrameAggregate;
import com.deepcheck.common.aggregation.FrameAggregator;
import com.deepcheck.common.aggregation.FrameJudgment;
import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.verification.classifier.Artifact;
import com.deepcheck.verification.classifier.ClassifierAdapter;
import com.deepcheck.verification.config.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs one adapter over every sampled frame and reduces the answers with {@link FrameAggregator}.
 *
 * <p>Frames are evaluated with bounded concurrency ({@code frameFanOut}) through
 * {@code flatMapSequential}, so judgments come back in timestamp order whatever order the calls
 * finish in. Each frame call has its own timeout. Failed frames are dropped; when no frame
 * survives the adapter is reported unavailable with a {@link ServiceException}.
 */
@Service
public class FrameAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FrameAnalysisService.class);

    private final FrameAggregator aggregator;
    private final PipelineSettings settings;

    public FrameAnalysisService(FrameAggregator aggregator, PipelineSettings settings) {
        this.aggregator = aggregator;
        this.settings = settings;
    }

    public Mono<FrameAggregate> analyze(ClassifierAdapter adapter, List<SampledFrame> frames) {
        String source = adapter.sourceName();
        return Flux.fromIterable(frames)
            .flatMapSequential(frame -> evaluateFrame(adapter, frame), settings.frameFanOut())
            .collectList()
            .flatMap(judged -> {
                if (judged.isEmpty()) {
                    return Mono.error(new ServiceException(source,
                        "all " + frames.size() + " frame evaluations failed"));
                }
                if (judged.size() < frames.size()) {
                    log.warn("[FrameAnalysis] {} judged {} of {} frames; failed frames dropped",
                             source, judged.size(), frames.size());
                }
                return Mono.just(aggregator.aggregate(source, judged));
            });
    }

    private Mono<FrameJudgment> evaluateFrame(ClassifierAdapter adapter, SampledFrame frame) {
        return Mono.defer(() -> adapter.evaluate(Artifact.frame(frame.jpeg(), frame.label())))
            .timeout(settings.callTimeout())
            .map(judgment -> new FrameJudgment(frame.index(), frame.timestamp(), judgment))
            .onErrorResume(e -> {
                log.warn("[FrameAnalysis] {} failed on {}. reason={}",
                         adapter.sourceName(), frame.label(), e.getMessage());
                return Mono.empty();
            });
    }
}
