package com.deepcheck.verification.service;

import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.trace.TraceContextUtil;
import com.deepcheck.verification.classifier.ClassifierAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs the same piece of work against both classifier adapters concurrently.
 *
 * <p>Each call is bounded by a timeout. A call that times out is <b>not</b> cancelled: the
 * in-flight request is left to finish, and whatever it eventually produces is logged and
 * discarded. Every error is converted into a failed {@link SourceOutcome}, so the combined
 * {@code Mono} always emits exactly two outcomes in adapter order.
 */
@Service
public class ClassifierDispatchService {

    private static final Logger log = LoggerFactory.getLogger(ClassifierDispatchService.class);

    private final List<ClassifierAdapter> adapters;

    public ClassifierDispatchService(List<ClassifierAdapter> adapters) {
        if (adapters == null || adapters.size() != 2) {
            throw new IllegalArgumentException("Exactly two classifier adapters are required but found "
                + (adapters == null ? 0 : adapters.size()));
        }
        this.adapters = List.copyOf(adapters);
        log.info("Classifier adapters registered. first={} second={}",
                 this.adapters.get(0).sourceName(), this.adapters.get(1).sourceName());
    }

    public List<ClassifierAdapter> adapters() {
        return adapters;
    }

    /**
     * @param call    the work to run per adapter (a single evaluation or a whole frame pass)
     * @param timeout bound applied to each adapter's {@code call} independently
     * @return both outcomes, first adapter first
     */
    public <T> Mono<List<SourceOutcome<T>>> dispatchBoth(Function<ClassifierAdapter, Mono<T>> call,
                                                         Duration timeout) {
        return Mono.zip(guarded(adapters.get(0), call, timeout), guarded(adapters.get(1), call, timeout))
            .map(pair -> List.of(pair.getT1(), pair.getT2()));
    }

    private <T> Mono<SourceOutcome<T>> guarded(ClassifierAdapter adapter,
                                               Function<ClassifierAdapter, Mono<T>> call,
                                               Duration timeout) {
        String source = adapter.sourceName();
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            CompletableFuture<T> inFlight = Mono.defer(() -> call.apply(adapter))
                .contextWrite(ctx)
                .toFuture();

            return Mono.fromFuture(inFlight, true)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new ServiceException(source, "returned no result")))
                .map(value -> SourceOutcome.success(source, value))
                .onErrorResume(e -> {
                    Throwable cause = unwrap(e);
                    if (cause instanceof TimeoutException) {
                        inFlight.whenComplete((late, err) -> TraceContextUtil.withMdc(traceId, () ->
                            log.info("[Dispatch] Late {} from {} discarded after timeout. traceId={}",
                                     err == null ? "result" : "error", source, traceId)));
                        TraceContextUtil.withMdc(traceId, () ->
                            log.warn("[Dispatch] {} timed out after {}. traceId={}", source, timeout, traceId));
                        return Mono.just(SourceOutcome.failure(source,
                            new ServiceException(source, "timed out after " + timeout)));
                    }
                    ServiceException failure = cause instanceof ServiceException se
                        ? se
                        : new ServiceException(source, String.valueOf(cause.getMessage()), cause);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("[Dispatch] {} unavailable. reason={} traceId={}", source, failure.getMessage(), traceId));
                    return Mono.just(SourceOutcome.failure(source, failure));
                });
        });
    }

    private static Throwable unwrap(Throwable e) {
        Throwable cause = Exceptions.unwrap(e);
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
