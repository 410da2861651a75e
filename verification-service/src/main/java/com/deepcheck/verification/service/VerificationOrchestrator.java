package com.deepcheck.verification.service;

import com.deepcheck.common.aggregation.FrameAggregate;
import com.deepcheck.common.consensus.ConsensusEngine;
import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.credibility.CredibilityScorer;
import com.deepcheck.common.exception.AnalysisNotFoundException;
import com.deepcheck.common.exception.DecodeException;
import com.deepcheck.common.exception.IllegalStateTransitionException;
import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.exception.ValidationException;
import com.deepcheck.common.explanation.AudienceLevel;
import com.deepcheck.common.metadata.MetadataHeuristicScorer;
import com.deepcheck.common.model.AnalysisStatus;
import com.deepcheck.common.model.FailureKind;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.trace.TraceContextUtil;
import com.deepcheck.verification.classifier.Artifact;
import com.deepcheck.verification.config.PipelineSettings;
import com.deepcheck.verification.explanation.ClaimExplanationService;
import com.deepcheck.verification.guard.ConsensusIntegrationGuard;
import com.deepcheck.verification.lifecycle.AnalysisStateMachine;
import com.deepcheck.verification.logger.VerificationFlowLogger;
import com.deepcheck.verification.metadata.MediaMetadataReader;
import com.deepcheck.verification.model.AnalysisRecord;
import com.deepcheck.verification.model.ClaimAnalysis;
import com.deepcheck.verification.model.JsonColumns;
import com.deepcheck.verification.model.MediaAnalysis;
import com.deepcheck.verification.model.MediaKind;
import com.deepcheck.verification.repository.ClaimAnalysisRepository;
import com.deepcheck.verification.repository.MediaAnalysisRepository;
import com.deepcheck.verification.storage.MediaStorageService;
import com.deepcheck.verification.video.FrameAnalysisService;
import com.deepcheck.verification.video.FrameSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives analysis records through their lifecycle.
 *
 * <p><strong>Pipelines</strong>:
 * <ul>
 *   <li>image: signature check → metadata heuristics ∥ both adapters → consensus</li>
 *   <li>video: K frames sampled → container metadata heuristics, one frame pass per adapter
 *       (in parallel) → consensus over the two aggregated judgments</li>
 *   <li>claim: both adapters on the text → consensus → credibility score and an explanation
 *       for the requested audience</li>
 * </ul>
 *
 * <p><strong>Outcomes</strong>: one adapter failing degrades the consensus; both failing
 * ends the record in {@code FAILED} with a {@code service_error} reason; an artifact that cannot
 * be decoded ends it with a {@code decode_error} reason. No automatic retries.
 *
 * <p><strong>Single writer</strong>: this service is the only caller of the repositories'
 * {@code save} for lifecycle changes, every change goes through {@link AnalysisStateMachine},
 * and at most one pipeline runs per record at any time.
 */
@Service
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    static final int MIN_CLAIM_LENGTH = 10;
    static final int MAX_CLAIM_LENGTH = 1000;

    private final MediaAnalysisRepository mediaRepository;
    private final ClaimAnalysisRepository claimRepository;
    private final MediaStorageService storage;
    private final ClassifierDispatchService dispatcher;
    private final FrameAnalysisService frameAnalysis;
    private final FrameSampler frameSampler;
    private final MediaMetadataReader metadataReader;
    private final ConsensusEngine consensusEngine;
    private final ClaimExplanationService explanationService;
    private final AnalysisStateMachine stateMachine;
    private final JsonColumns json;
    private final PipelineSettings settings;
    private final VerificationFlowLogger flowLogger;
    private final Clock clock;

    /** Keys ("media:7", "claim:3") of records whose pipeline is currently running. */
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public VerificationOrchestrator(MediaAnalysisRepository mediaRepository,
                                    ClaimAnalysisRepository claimRepository,
                                    MediaStorageService storage,
                                    ClassifierDispatchService dispatcher,
                                    FrameAnalysisService frameAnalysis,
                                    FrameSampler frameSampler,
                                    MediaMetadataReader metadataReader,
                                    ConsensusEngine consensusEngine,
                                    ClaimExplanationService explanationService,
                                    AnalysisStateMachine stateMachine,
                                    JsonColumns json,
                                    PipelineSettings settings,
                                    VerificationFlowLogger flowLogger,
                                    Clock clock) {
        this.mediaRepository = mediaRepository;
        this.claimRepository = claimRepository;
        this.storage = storage;
        this.dispatcher = dispatcher;
        this.frameAnalysis = frameAnalysis;
        this.frameSampler = frameSampler;
        this.metadataReader = metadataReader;
        this.consensusEngine = consensusEngine;
        this.explanationService = explanationService;
        this.stateMachine = stateMachine;
        this.json = json;
        this.settings = settings;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    // ── submission ────────────────────────────────────────────────────────────

    /**
     * Validates and stores an upload, then persists a {@code PENDING} record.
     * Nothing is stored and no record exists when validation fails.
     */
    public Mono<MediaAnalysis> submitMedia(String filename, byte[] bytes, String description) {
        return Mono.defer(() -> {
            MediaKind kind = validateMedia(filename, bytes);
            return storage.store(filename, bytes).flatMap(path -> {
                MediaAnalysis record = new MediaAnalysis();
                record.setFilename(filename);
                record.setStoragePath(path);
                record.setMediaType(kind.name());
                record.setFileSize((long) bytes.length);
                record.setUserDescription(description == null || description.isBlank() ? null : description.trim());
                record.setStatus(AnalysisStatus.PENDING.name());
                record.setTraceId(TraceContextUtil.newTraceId());
                record.setSubmittedAt(LocalDateTime.now(clock));
                return mediaRepository.save(record);
            });
        })
        .doOnSuccess(r -> log.info("Media submitted. id={} filename={} type={} bytes={} traceId={}",
                                   r.getId(), r.getFilename(), r.getMediaType(), r.getFileSize(), r.getTraceId()));
    }

    public Mono<ClaimAnalysis> submitClaim(String text, String sourceUrl) {
        return submitClaim(text, sourceUrl, null);
    }

    /**
     * Persists a {@code PENDING} claim. {@code audienceLevel} picks who the completed record's
     * audience explanation is written for; blank or unknown means {@code GENERAL}.
     */
    public Mono<ClaimAnalysis> submitClaim(String text, String sourceUrl, String audienceLevel) {
        return Mono.defer(() -> {
            String claim = validateClaim(text);
            ClaimAnalysis record = new ClaimAnalysis();
            record.setText(claim);
            record.setSourceUrl(validateSourceUrl(sourceUrl));
            record.setAudienceLevel(AudienceLevel.parse(audienceLevel).name());
            record.setStatus(AnalysisStatus.PENDING.name());
            record.setTraceId(TraceContextUtil.newTraceId());
            record.setSubmittedAt(LocalDateTime.now(clock));
            return claimRepository.save(record);
        })
        .doOnSuccess(r -> log.info("Claim submitted. id={} length={} traceId={}",
                                   r.getId(), r.getText().length(), r.getTraceId()));
    }

    // ── start / analyze ───────────────────────────────────────────────────────

    /**
     * Moves the record to {@code ANALYZING}, emits it, and runs the pipeline in the background
     * on a freshly loaded copy, so the emitted instance is never mutated afterwards.
     */
    public Mono<MediaAnalysis> startMediaAnalysis(Long id) {
        return beginMedia(id).doOnNext(started -> mediaRepository.findById(started.getId())
            .switchIfEmpty(Mono.fromRunnable(() -> running.remove(runKey(started))))
            .flatMap(this::runMedia)
            .subscribe(
                done -> { },
                e -> log.error("Media pipeline could not persist its outcome. id={} traceId={}",
                               started.getId(), started.getTraceId(), e)));
    }

    /** Same as {@link #startMediaAnalysis} but completes with the terminal record. */
    public Mono<MediaAnalysis> analyzeMedia(Long id) {
        return beginMedia(id).flatMap(this::runMedia);
    }

    public Mono<ClaimAnalysis> startClaimAnalysis(Long id) {
        return beginClaim(id).doOnNext(started -> claimRepository.findById(started.getId())
            .switchIfEmpty(Mono.fromRunnable(() -> running.remove(runKey(started))))
            .flatMap(this::runClaim)
            .subscribe(
                done -> { },
                e -> log.error("Claim pipeline could not persist its outcome. id={} traceId={}",
                               started.getId(), started.getTraceId(), e)));
    }

    public Mono<ClaimAnalysis> analyzeClaim(Long id) {
        return beginClaim(id).flatMap(this::runClaim);
    }

    private Mono<MediaAnalysis> beginMedia(Long id) {
        return mediaRepository.findById(id)
            .switchIfEmpty(Mono.error(() -> new AnalysisNotFoundException("media", id)))
            .flatMap(record -> begin(record, mediaRepository::save));
    }

    private Mono<ClaimAnalysis> beginClaim(Long id) {
        return claimRepository.findById(id)
            .switchIfEmpty(Mono.error(() -> new AnalysisNotFoundException("claim", id)))
            .flatMap(record -> begin(record, claimRepository::save));
    }

    private <R extends AnalysisRecord> Mono<R> begin(R record, Function<R, Mono<R>> save) {
        String key = runKey(record);
        if (!running.add(key)) {
            return Mono.error(new IllegalStateTransitionException(record.getId(),
                AnalysisStatus.ANALYZING, AnalysisStatus.ANALYZING));
        }
        try {
            stateMachine.begin(record);
        } catch (IllegalStateTransitionException e) {
            running.remove(key);
            return Mono.error(e);
        }
        return save.apply(record)
            .doOnError(e -> running.remove(key))
            .doOnNext(saved -> flowLogger.logWithTraceId(VerificationFlowLogger.ANALYSIS_STARTED,
                                                         saved.kind(), saved.getId(), saved.getTraceId()));
    }

    // ── media pipeline ────────────────────────────────────────────────────────

    private Mono<MediaAnalysis> runMedia(MediaAnalysis record) {
        Mono<MediaEvaluation> evaluation = record.mediaKind() == MediaKind.VIDEO
            ? evaluateVideo(record)
            : evaluateImage(record);

        Mono<MediaAnalysis> pipeline = evaluation
            .map(ev -> {
                record.setMetadataFindings(json.write(ev.metadataFindings()));
                if (!ev.frames().isEmpty()) {
                    record.setFrameAnalysis(json.write(ev.frames()));
                }
                ConsensusResult result = resolve(record, ev.outcomes(), ev.metadataFindings());
                return stateMachine.complete(record, result);
            })
            .onErrorResume(e -> Mono.just(failRecord(record, e)))
            .flatMap(mediaRepository::save)
            .doOnNext(this::logTerminal)
            .doFinally(signal -> running.remove(runKey(record)));

        return TraceContextUtil.withTraceId(pipeline, record.getTraceId());
    }

    private Mono<MediaEvaluation> evaluateImage(MediaAnalysis record) {
        String mimeType = MediaKind.mimeType(record.getFilename());
        return storage.read(record.getStoragePath())
            .flatMap(bytes -> {
                metadataReader.requireDecodableImage(bytes);

                Mono<List<Finding>> metadata = Mono.fromCallable(
                        () -> MetadataHeuristicScorer.score(metadataReader.readImage(bytes)))
                    .subscribeOn(Schedulers.boundedElastic());

                Mono<List<SourceOutcome<Judgment>>> outcomes = dispatcher
                    .dispatchBoth(adapter -> adapter.evaluate(Artifact.image(bytes, mimeType)), settings.callTimeout())
                    .doOnEach(flowLogger.stage(VerificationFlowLogger.CLASSIFIERS_COMPLETED));

                return Mono.zip(outcomes, metadata)
                    .map(t -> new MediaEvaluation(t.getT1(), t.getT2(), List.of()));
            });
    }

    private Mono<MediaEvaluation> evaluateVideo(MediaAnalysis record) {
        Path video = storage.resolve(record.getStoragePath());
        return Mono.fromCallable(() -> frameSampler.sample(video, settings.frameCount()))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(settings.samplingTimeout(), Mono.error(() -> new DecodeException(
                "frame sampling did not finish within " + settings.samplingTimeout().toMillis() + "ms")))
            .doOnEach(flowLogger.stage(VerificationFlowLogger.FRAMES_SAMPLED))
            .flatMap(sample -> {
                List<Finding> metadataFindings =
                    MetadataHeuristicScorer.score(metadataReader.fromProbe(sample.probe()));

                return dispatcher
                    .dispatchBoth(adapter -> frameAnalysis.analyze(adapter, sample.frames()),
                                  settings.framePassTimeout())
                    .doOnEach(flowLogger.stage(VerificationFlowLogger.FRAMES_AGGREGATED))
                    .map(passes -> {
                        List<SourceOutcome<Judgment>> outcomes = passes.stream()
                            .map(p -> p.isSuccess()
                                ? SourceOutcome.success(p.source(), p.value().judgment())
                                : SourceOutcome.<Judgment>failure(p.source(), p.error()))
                            .toList();
                        List<FrameAggregate> aggregates = passes.stream()
                            .filter(SourceOutcome::isSuccess)
                            .map(SourceOutcome::value)
                            .toList();
                        return new MediaEvaluation(outcomes, metadataFindings, aggregates);
                    });
            });
    }

    // ── claim pipeline ────────────────────────────────────────────────────────

    private Mono<ClaimAnalysis> runClaim(ClaimAnalysis record) {
        Mono<ClaimAnalysis> pipeline = dispatcher
            .dispatchBoth(adapter -> adapter.evaluate(Artifact.claim(record.getText())), settings.callTimeout())
            .doOnEach(flowLogger.stage(VerificationFlowLogger.CLASSIFIERS_COMPLETED))
            .map(outcomes -> resolve(record, outcomes, List.of()))
            .flatMap(result -> explanationService
                .explain(record.getText(), result, AudienceLevel.parse(record.getAudienceLevel()))
                .map(explanation -> {
                    stateMachine.complete(record, result);
                    record.setCredibilityScore(CredibilityScorer.score(result));
                    record.setAudienceExplanation(json.write(explanation));
                    return record;
                }))
            .onErrorResume(e -> Mono.just(failRecord(record, e)))
            .flatMap(claimRepository::save)
            .doOnNext(this::logTerminal)
            .doFinally(signal -> running.remove(runKey(record)));

        return TraceContextUtil.withTraceId(pipeline, record.getTraceId());
    }

    // ── shared ────────────────────────────────────────────────────────────────

    /**
     * Hands the successful judgments (in adapter order) to the resolver.
     *
     * @throws ServiceException when no adapter produced a judgment
     */
    private ConsensusResult resolve(AnalysisRecord record, List<SourceOutcome<Judgment>> outcomes,
                                    List<Finding> supplementary) {
        List<Judgment> judgments = outcomes.stream()
            .filter(SourceOutcome::isSuccess)
            .map(SourceOutcome::value)
            .toList();

        if (judgments.isEmpty()) {
            String reasons = outcomes.stream()
                .map(o -> o.error().getMessage())
                .collect(Collectors.joining("; "));
            throw new ServiceException("classifiers", "all classifiers unavailable: " + reasons);
        }
        if (judgments.size() < outcomes.size()) {
            log.warn("Degraded consensus for {} {}: only {} answered",
                     record.kind(), record.getId(),
                     judgments.stream().map(Judgment::source).collect(Collectors.joining(",")));
        }

        ConsensusResult result = ConsensusIntegrationGuard.resolve(judgments, consensusEngine, supplementary);
        flowLogger.logConsensus(result, record.kind(), record.getId(), record.getTraceId());
        return result;
    }

    private <R extends AnalysisRecord> R failRecord(R record, Throwable error) {
        FailureKind kind;
        if (error instanceof DecodeException) {
            kind = FailureKind.UNDECODABLE_ARTIFACT;
        } else if (error instanceof ServiceException) {
            kind = FailureKind.SERVICE_UNAVAILABLE;
        } else {
            kind = FailureKind.INTERNAL_ERROR;
            log.error("Unexpected fault in {} pipeline. id={} traceId={}",
                      record.kind(), record.getId(), record.getTraceId(), error);
        }
        stateMachine.fail(record, kind, error.getMessage());
        return record;
    }

    private void logTerminal(AnalysisRecord record) {
        if (record.status() == AnalysisStatus.COMPLETED) {
            flowLogger.logWithTraceId(VerificationFlowLogger.RECORD_COMPLETED,
                                      record.kind(), record.getId(), record.getTraceId());
        } else {
            flowLogger.logFailure(record.kind(), record.getId(), record.getErrorReason(),
                                  record.getTraceId());
        }
    }

    private static String runKey(AnalysisRecord record) {
        return record.kind() + ":" + record.getId();
    }

    // ── validation ────────────────────────────────────────────────────────────

    MediaKind validateMedia(String filename, byte[] bytes) {
        if (filename == null || filename.isBlank()) {
            throw new ValidationException("filename is required");
        }
        MediaKind kind = MediaKind.fromFilename(filename).orElseThrow(() -> new ValidationException(
            "unsupported file type: " + filename + " (allowed: .jpg .jpeg .png .mp4 .avi .mov .webm)"));
        if (bytes == null || bytes.length == 0) {
            throw new ValidationException("file is empty");
        }
        if (bytes.length > storage.maxUploadBytes()) {
            throw new ValidationException("file exceeds the " + storage.maxUploadBytes() + " byte upload limit");
        }
        return kind;
    }

    static String validateClaim(String text) {
        String claim = text == null ? "" : text.trim();
        if (claim.length() < MIN_CLAIM_LENGTH || claim.length() > MAX_CLAIM_LENGTH) {
            throw new ValidationException("claim text must be between " + MIN_CLAIM_LENGTH + " and "
                + MAX_CLAIM_LENGTH + " characters but was " + claim.length());
        }
        return claim;
    }

    static String validateSourceUrl(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) return null;
        String url = sourceUrl.trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new ValidationException("source URL must be http or https: " + url);
        }
        return url;
    }

    private record MediaEvaluation(List<SourceOutcome<Judgment>> outcomes,
                                   List<Finding> metadataFindings,
                                   List<FrameAggregate> frames) {}
}
