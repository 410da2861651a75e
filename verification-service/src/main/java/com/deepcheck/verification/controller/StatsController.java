package com.deepcheck.verification.controller;

import com.deepcheck.verification.dto.StatsDTO;
import com.deepcheck.verification.service.VerificationQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
public class StatsController {

    private final VerificationQueryService queryService;

    public StatsController(VerificationQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<StatsDTO>> stats() {
        return queryService.stats().map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
