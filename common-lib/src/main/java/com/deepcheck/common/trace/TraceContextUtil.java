package com.deepcheck.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive trace propagation for analysis pipelines.
 *
 * <p>Reactor Context carries the traceId of the analysis being run. MDC is written only as a
 * temporary bridge around a single log statement, never as a persistent ThreadLocal store:
 * pipeline stages hop between {@code boundedElastic} and Netty threads.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, record.getTraceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end of pipeline
     * assembly; {@code contextWrite} propagates upstream during subscription.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * @return the traceId from the context, or {@code "unknown"}; never {@code null}
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
