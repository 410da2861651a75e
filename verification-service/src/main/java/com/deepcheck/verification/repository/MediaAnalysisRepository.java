package com.deepcheck.verification.repository;

import com.deepcheck.verification.model.MediaAnalysis;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface MediaAnalysisRepository extends ReactiveCrudRepository<MediaAnalysis, Long> {

    @Query("""
        SELECT * FROM media_analysis
        ORDER BY submitted_at DESC, id DESC
        LIMIT :limit OFFSET :offset
        """)
    Flux<MediaAnalysis> findPage(int limit, long offset);

    @Query("""
        SELECT * FROM media_analysis
        WHERE status = :status
        ORDER BY submitted_at DESC, id DESC
        LIMIT :limit OFFSET :offset
        """)
    Flux<MediaAnalysis> findPageByStatus(String status, int limit, long offset);

    Mono<Long> countByStatus(String status);

    Mono<Long> countByVerdict(String verdict);
}
