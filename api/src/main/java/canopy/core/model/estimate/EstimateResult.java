package canopy.core.model.estimate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of a handled estimate request.
 *
 * @param estimate        the calibrated estimate
 * @param providerName    provider whose answer was used (baseline included)
 * @param fallbackLevel   level of that provider in the default, unreordered chain
 * @param fromCache       whether the answer was served from the result cache
 * @param attempts        one record per physical attempt, empty on a cache hit
 * @param selectionReason why the provider order was chosen, empty on a cache hit
 * @param totalLatency    time from receipt to answer
 */
public record EstimateResult(
        NutrientEstimate estimate,
        String providerName,
        int fallbackLevel,
        boolean fromCache,
        List<AttemptRecord> attempts,
        String selectionReason,
        Duration totalLatency) {

    public EstimateResult {
        Objects.requireNonNull(estimate, "estimate must not be null");
        Objects.requireNonNull(providerName, "providerName must not be null");
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        selectionReason = selectionReason == null ? "" : selectionReason;
        totalLatency = Objects.requireNonNullElse(totalLatency, Duration.ZERO);
    }
}
