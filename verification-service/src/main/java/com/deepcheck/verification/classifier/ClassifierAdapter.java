package com.deepcheck.verification.classifier;

import com.deepcheck.common.exception.ServiceException;
import com.deepcheck.common.model.Judgment;
import reactor.core.publisher.Mono;

/**
 * An external AI classification service.
 *
 * <p>Contract:
 * <ul>
 *   <li>emits exactly one {@link Judgment} whose {@code source} is {@link #sourceName()}</li>
 *   <li>errors with {@link com.deepcheck.common.exception.ServiceException} when the service is
 *       unreachable, refuses the call or answers with something unparseable</li>
 *   <li>an ambiguous or low-confidence answer is a successful {@code UNCERTAIN} judgment, not an error</li>
 * </ul>
 *
 * <p>The orchestrator bounds every call with its own timeout; implementations need not.
 */
public interface ClassifierAdapter {

    String sourceName();

    Mono<Judgment> evaluate(Artifact artifact);

    /**
     * Free-form completion of {@code prompt}, returning the model's raw text answer.
     * Services that cannot do this error with {@link ServiceException}.
     */
    default Mono<String> generateText(String prompt) {
        return Mono.error(new ServiceException(sourceName(), "text generation not supported"));
    }
}
