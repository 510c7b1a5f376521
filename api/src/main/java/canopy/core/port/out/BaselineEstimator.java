package canopy.core.port.out;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.ProviderReading;

/**
 * Port interface for the terminal, always-available estimate source.
 *
 * <p>Implementations have no external dependency and are expected never to fail.
 * A failure here is a defect and ends the request with
 * {@link canopy.core.exception.ChainExhaustedException}.
 */
public interface BaselineEstimator {

    /**
     * Name reported for baseline results.
     */
    String NAME = "baseline";

    /**
     * Produce the baseline reading for the request.
     *
     * @param request the estimate request
     * @return the reading
     */
    ProviderReading estimate(EstimateRequest request);
}
