package com.deepcheck.verification.logger;

import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the analysis lifecycle. Logs each stage of a record's journey
 * without touching the pipeline's values. All methods are pure side-effects.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #ANALYSIS_STARTED}      record moved to ANALYZING</li>
 *   <li>{@link #FRAMES_SAMPLED}        video decoded into K frames (videos only)</li>
 *   <li>{@link #CLASSIFIERS_COMPLETED} both adapters answered, failed or timed out (images, claims)</li>
 *   <li>{@link #FRAMES_AGGREGATED}     both adapters finished their frame passes (videos only)</li>
 *   <li>{@link #CONSENSUS_RESOLVED}    resolver produced a ConsensusResult</li>
 *   <li>{@link #RECORD_COMPLETED}      terminal COMPLETED record persisted</li>
 *   <li>{@link #RECORD_FAILED}         terminal FAILED record persisted</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(VerificationFlowLogger.FRAMES_SAMPLED))
 * </pre>
 */
@Component
public class VerificationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(VerificationFlowLogger.class);

    public static final String ANALYSIS_STARTED      = "ANALYSIS_STARTED";
    public static final String FRAMES_SAMPLED        = "FRAMES_SAMPLED";
    public static final String CLASSIFIERS_COMPLETED = "CLASSIFIERS_COMPLETED";
    public static final String FRAMES_AGGREGATED     = "FRAMES_AGGREGATED";
    public static final String CONSENSUS_RESOLVED    = "CONSENSUS_RESOLVED";
    public static final String RECORD_COMPLETED      = "RECORD_COMPLETED";
    public static final String RECORD_FAILED         = "RECORD_FAILED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * Bridges Context → MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[VerificationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String kind, Long recordId, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[VerificationFlow] stage={} kind={} id={} traceId={}", stageName, kind, recordId, traceId)
        );
    }

    public void logConsensus(ConsensusResult result, String kind, Long recordId, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[VerificationFlow] stage={} kind={} id={} verdict={} confidence={} agreement={} "
                     + "sources={} metadataAlignment={} traceId={}",
                     CONSENSUS_RESOLVED, kind, recordId,
                     result.finalVerdict(), String.format("%.3f", result.finalConfidence()), result.agreement(),
                     result.contributingJudgments().size(), result.metadataAlignment(), traceId)
        );
    }

    public void logFailure(String kind, Long recordId, String reason, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[VerificationFlow] stage={} kind={} id={} reason={} traceId={}",
                     RECORD_FAILED, kind, recordId, reason, traceId)
        );
    }
}
