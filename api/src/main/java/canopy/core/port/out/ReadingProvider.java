package canopy.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.ProviderReading;

/**
 * Port interface for an upstream data provider.
 *
 * <p>Implementations fail the returned {@link Uni} with a
 * {@link canopy.core.exception.ProviderException} subtype describing the failure kind.
 * Any other failure is treated as the provider being unavailable.
 *
 * <p>Implementations must honour cancellation: once the caller cancels, the
 * in-flight call should be abandoned.
 */
public interface ReadingProvider {

    /**
     * @return the provider name, matching its descriptor
     */
    String name();

    /**
     * Fetch a reading for the request.
     *
     * @param request  the estimate request
     * @param deadline instant by which the attempt is abandoned
     * @return the reading
     */
    Uni<ProviderReading> fetch(EstimateRequest request, Instant deadline);
}
