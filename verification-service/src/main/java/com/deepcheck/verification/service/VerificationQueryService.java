package com.deepcheck.verification.service;

import com.deepcheck.common.exception.AnalysisNotFoundException;
import com.deepcheck.common.exception.ValidationException;
import com.deepcheck.common.model.AnalysisStatus;
import com.deepcheck.common.model.Verdict;
import com.deepcheck.verification.dto.StatsDTO;
import com.deepcheck.verification.dto.VerificationResultDTO;
import com.deepcheck.verification.repository.ClaimAnalysisRepository;
import com.deepcheck.verification.repository.MediaAnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Read side of the verification store: single records, newest-first pages and counters.
 */
@Service
public class VerificationQueryService {

    private static final Logger log = LoggerFactory.getLogger(VerificationQueryService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final MediaAnalysisRepository mediaRepository;
    private final ClaimAnalysisRepository claimRepository;
    private final AnalysisRecordMapper mapper;

    public VerificationQueryService(MediaAnalysisRepository mediaRepository,
                                    ClaimAnalysisRepository claimRepository,
                                    AnalysisRecordMapper mapper) {
        this.mediaRepository = mediaRepository;
        this.claimRepository = claimRepository;
        this.mapper = mapper;
    }

    public Mono<VerificationResultDTO> getMedia(Long id) {
        return mediaRepository.findById(id)
            .switchIfEmpty(Mono.error(() -> new AnalysisNotFoundException("media", id)))
            .map(mapper::toDto);
    }

    public Mono<VerificationResultDTO> getClaim(Long id) {
        return claimRepository.findById(id)
            .switchIfEmpty(Mono.error(() -> new AnalysisNotFoundException("claim", id)))
            .map(mapper::toDto);
    }

    public Flux<VerificationResultDTO> listMedia(String status, int skip, int limit) {
        return Flux.defer(() -> {
            checkPage(skip, limit);
            String filter = parseStatus(status);
            return filter == null
                ? mediaRepository.findPage(limit, skip)
                : mediaRepository.findPageByStatus(filter, limit, skip);
        }).map(mapper::toDto);
    }

    public Flux<VerificationResultDTO> listClaims(String status, int skip, int limit) {
        return Flux.defer(() -> {
            checkPage(skip, limit);
            String filter = parseStatus(status);
            return filter == null
                ? claimRepository.findPage(limit, skip)
                : claimRepository.findPageByStatus(filter, limit, skip);
        }).map(mapper::toDto);
    }

    public Mono<StatsDTO> stats() {
        return Mono.zip(
                countByStatus(mediaRepository::countByStatus),
                countByStatus(claimRepository::countByStatus),
                mediaRepository.countByVerdict(Verdict.MANIPULATED.name()),
                claimRepository.countByVerdict(Verdict.FALSE.name()))
            .map(t -> new StatsDTO(
                t.getT1(), t.getT2(),
                t.getT1().values().stream().mapToLong(Long::longValue).sum(),
                t.getT2().values().stream().mapToLong(Long::longValue).sum(),
                t.getT3(), t.getT4()))
            .doOnSuccess(s -> log.debug("Stats computed. media={} claims={}", s.totalMedia(), s.totalClaims()));
    }

    private static Mono<Map<String, Long>> countByStatus(Function<String, Mono<Long>> counter) {
        return Flux.fromArray(AnalysisStatus.values())
            .concatMap(status -> counter.apply(status.name())
                .defaultIfEmpty(0L)
                .map(count -> Map.entry(status.name(), count)))
            .collect(LinkedHashMap::new, (map, e) -> map.put(e.getKey(), e.getValue()));
    }

    private static void checkPage(int skip, int limit) {
        if (skip < 0) {
            throw new ValidationException("skip must not be negative but was " + skip);
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("limit must be between 1 and " + MAX_PAGE_SIZE + " but was " + limit);
        }
    }

    /** @return the normalised status name, or {@code null} when no filter was requested */
    private static String parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return AnalysisStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)).name();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown status: " + status);
        }
    }
}
