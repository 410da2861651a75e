package com.deepcheck.verification.guard;

import com.deepcheck.common.consensus.ConsensusEngine;
import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;

import java.util.List;

/**
 * Pipeline safety wrapper for {@link ConsensusEngine} invocations.
 *
 * <p>The engine is only ever handed one or two judgments. Anything else is a pipeline bug:
 * the orchestrator fails a record whose classifiers all failed before it reaches this point,
 * so no fallback result is ever fabricated here.
 *
 * <p>This class is a pure utility:
 * <ul>
 *   <li>No reactive types</li>
 *   <li>No logging</li>
 *   <li>No state</li>
 *   <li>No Spring dependency</li>
 * </ul>
 */
public final class ConsensusIntegrationGuard {

    private ConsensusIntegrationGuard() {}

    /**
     * Delegates to {@code engine.compute(judgments, supplementary)} after the arity guard.
     *
     * @param judgments     successful judgments in source order (one or two)
     * @param engine        the consensus engine
     * @param supplementary metadata findings; {@code null} is treated as none
     * @return a {@link ConsensusResult}, never {@code null}
     * @throws IllegalArgumentException when {@code judgments} is null, empty or larger than two
     */
    public static ConsensusResult resolve(List<Judgment> judgments, ConsensusEngine engine,
                                          List<Finding> supplementary) {
        if (judgments == null || judgments.isEmpty()) {
            throw new IllegalArgumentException("Consensus requires at least one judgment");
        }
        if (judgments.size() > 2) {
            throw new IllegalArgumentException("Consensus accepts at most two judgments but got " + judgments.size());
        }
        return engine.compute(judgments, supplementary == null ? List.of() : supplementary);
    }
}
