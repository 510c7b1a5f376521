package canopy.core.model.estimate;

import java.util.Objects;

/**
 * Value stored in the result cache: the estimate plus where it came from.
 *
 * @param estimate      the calibrated estimate
 * @param providerName  provider that won the walk
 * @param fallbackLevel the provider's level in the default ordering
 */
public record CachedEstimate(NutrientEstimate estimate, String providerName, int fallbackLevel) {

    public CachedEstimate {
        Objects.requireNonNull(estimate, "estimate must not be null");
        Objects.requireNonNull(providerName, "providerName must not be null");
    }
}
