package com.deepcheck.verification.controller;

import com.deepcheck.common.exception.ValidationException;
import com.deepcheck.verification.dto.SubmitClaimRequest;
import com.deepcheck.verification.dto.VerificationResultDTO;
import com.deepcheck.verification.service.AnalysisRecordMapper;
import com.deepcheck.verification.service.VerificationOrchestrator;
import com.deepcheck.verification.service.VerificationQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/claims")
public class ClaimVerificationController {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerificationController.class);

    private final VerificationOrchestrator orchestrator;
    private final VerificationQueryService queryService;
    private final AnalysisRecordMapper mapper;

    public ClaimVerificationController(VerificationOrchestrator orchestrator,
                                       VerificationQueryService queryService,
                                       AnalysisRecordMapper mapper) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
        this.mapper = mapper;
    }

    @PostMapping
    public Mono<ResponseEntity<VerificationResultDTO>> submit(@RequestBody(required = false) SubmitClaimRequest request) {
        if (request == null) {
            return Mono.error(new ValidationException("request body is required"));
        }
        return orchestrator.submitClaim(request.text(), request.sourceUrl(), request.audienceLevel())
            .map(record -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(record)));
    }

    @PostMapping("/{id}/analyze")
    public Mono<ResponseEntity<VerificationResultDTO>> analyze(
            @PathVariable Long id,
            @RequestParam(value = "wait", defaultValue = "false") boolean wait) {
        log.info("Claim analysis requested. id={} wait={}", id, wait);
        if (wait) {
            return orchestrator.analyzeClaim(id)
                .map(record -> ResponseEntity.ok(mapper.toDto(record)));
        }
        return orchestrator.startClaimAnalysis(id)
            .map(record -> ResponseEntity.status(HttpStatus.ACCEPTED).body(mapper.toDto(record)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<VerificationResultDTO>> get(@PathVariable Long id) {
        return queryService.getClaim(id).map(ResponseEntity::ok);
    }

    @GetMapping
    public Flux<VerificationResultDTO> list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        log.info("Claim list query received. status={} skip={} limit={}", status, skip, limit);
        return queryService.listClaims(status, skip, limit);
    }
}
