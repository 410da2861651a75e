package com.deepcheck.common.consensus;

import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;

import java.util.List;

/**
 * Strategy contract for fusing classifier judgments into one verdict.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Deterministic</b>: equal input yields an equal {@link ConsensusResult}</li>
 * </ul>
 *
 * <p>Current implementation: {@link DualSourceConsensusStrategy}.
 * Register as a Spring {@code @Bean} in {@code VerificationConfig} to swap strategies.
 */
public interface ConsensusEngine {

    /**
     * Fuse one or two judgments, with no supplementary evidence.
     *
     * @param judgments one (degraded) or two judgments, in source order
     * @return a {@link ConsensusResult}, never {@code null}
     */
    default ConsensusResult compute(List<Judgment> judgments) {
        return compute(judgments, List.of());
    }

    /**
     * Fuse one or two judgments and append supplementary findings (e.g. metadata heuristics)
     * after the judgments' own findings. Supplementary findings never move the confidence.
     *
     * @param judgments     one or two judgments, in source order
     * @param supplementary findings appended last; may be empty
     * @return a {@link ConsensusResult}, never {@code null}
     */
    ConsensusResult compute(List<Judgment> judgments, List<Finding> supplementary);
}
