package com.deepcheck.verification.controller;

import com.deepcheck.common.exception.ValidationException;
import com.deepcheck.verification.dto.VerificationResultDTO;
import com.deepcheck.verification.service.AnalysisRecordMapper;
import com.deepcheck.verification.service.VerificationOrchestrator;
import com.deepcheck.verification.service.VerificationQueryService;
import com.deepcheck.verification.storage.MediaStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/media")
public class MediaVerificationController {

    private static final Logger log = LoggerFactory.getLogger(MediaVerificationController.class);

    private final VerificationOrchestrator orchestrator;
    private final VerificationQueryService queryService;
    private final AnalysisRecordMapper mapper;
    private final MediaStorageService storage;

    public MediaVerificationController(VerificationOrchestrator orchestrator,
                                       VerificationQueryService queryService,
                                       AnalysisRecordMapper mapper,
                                       MediaStorageService storage) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
        this.mapper = mapper;
        this.storage = storage;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<VerificationResultDTO>> upload(
            @RequestPart("file") FilePart file,
            @RequestPart(value = "description", required = false) String description) {
        log.info("Media upload received. filename={}", file.filename());
        int limit = (int) Math.min(Integer.MAX_VALUE, storage.maxUploadBytes());
        return DataBufferUtils.join(file.content(), limit)
            .onErrorMap(DataBufferLimitException.class,
                        e -> new ValidationException("file exceeds the " + limit + " byte upload limit"))
            .map(buffer -> {
                byte[] bytes = new byte[buffer.readableByteCount()];
                buffer.read(bytes);
                DataBufferUtils.release(buffer);
                return bytes;
            })
            .defaultIfEmpty(new byte[0])
            .flatMap(bytes -> orchestrator.submitMedia(file.filename(), bytes, description))
            .map(record -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(record)))
            .doOnError(e -> log.error("Upload endpoint error. filename={}", file.filename(), e));
    }

    /**
     * Starts analysis of a {@code PENDING} record. Answers 202 with the {@code ANALYZING} record,
     * or 200 with the terminal record when {@code wait=true}.
     */
    @PostMapping("/{id}/analyze")
    public Mono<ResponseEntity<VerificationResultDTO>> analyze(
            @PathVariable Long id,
            @RequestParam(value = "wait", defaultValue = "false") boolean wait) {
        log.info("Media analysis requested. id={} wait={}", id, wait);
        if (wait) {
            return orchestrator.analyzeMedia(id)
                .map(record -> ResponseEntity.ok(mapper.toDto(record)));
        }
        return orchestrator.startMediaAnalysis(id)
            .map(record -> ResponseEntity.status(HttpStatus.ACCEPTED).body(mapper.toDto(record)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<VerificationResultDTO>> get(@PathVariable Long id) {
        return queryService.getMedia(id).map(ResponseEntity::ok);
    }

    @GetMapping
    public Flux<VerificationResultDTO> list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        log.info("Media list query received. status={} skip={} limit={}", status, skip, limit);
        return queryService.listMedia(status, skip, limit);
    }
}
