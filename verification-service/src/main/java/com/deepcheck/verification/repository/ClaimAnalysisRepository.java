package com.deepcheck.verification.repository;

import com.deepcheck.verification.model.ClaimAnalysis;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ClaimAnalysisRepository extends ReactiveCrudRepository<ClaimAnalysis, Long> {

    @Query("""
        SELECT * FROM claim_analysis
        ORDER BY submitted_at DESC, id DESC
        LIMIT :limit OFFSET :offset
        """)
    Flux<ClaimAnalysis> findPage(int limit, long offset);

    @Query("""
        SELECT * FROM claim_analysis
        WHERE status = :status
        ORDER BY submitted_at DESC, id DESC
        LIMIT :limit OFFSET :offset
        """)
    Flux<ClaimAnalysis> findPageByStatus(String status, int limit, long offset);

    Mono<Long> countByStatus(String status);

    Mono<Long> countByVerdict(String verdict);
}
