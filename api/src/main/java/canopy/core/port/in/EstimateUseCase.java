package canopy.core.port.in;

import io.smallrye.mutiny.Uni;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.EstimateResult;

/**
 * Use case for producing a nutrient estimate through the provider fallback chain.
 *
 * <p>Admission control is not part of this use case; callers check the
 * {@link canopy.core.port.out.RateLimiter} first.
 */
public interface EstimateUseCase {

    /**
     * Answer a request from the cache or from the first provider that succeeds.
     *
     * <p>Provider failures never fail the returned {@link Uni} while the baseline
     * estimator works; the only failure is {@link canopy.core.exception.ChainExhaustedException}.
     *
     * @param request the request
     * @return the result
     */
    Uni<EstimateResult> handle(EstimateRequest request);
}
