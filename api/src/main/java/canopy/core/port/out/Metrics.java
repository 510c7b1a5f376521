package canopy.core.port.out;

import java.util.function.Supplier;

import canopy.core.model.estimate.AttemptOutcome;

/**
 * Port interface for recording service metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a handled top-level request.
     *
     * @param outcome   {@code success} or {@code failure}
     * @param source    {@code cache}, {@code provider} or {@code baseline}
     * @param latencyMs request latency in milliseconds
     */
    void recordRequest(String outcome, String source, long latencyMs);

    /**
     * Record one physical provider attempt.
     *
     * @param provider  the provider name
     * @param outcome   how the attempt ended
     * @param latencyMs attempt latency in milliseconds
     */
    void recordAttempt(String provider, AttemptOutcome outcome, long latencyMs);

    void recordCacheLookup(boolean hit);

    void recordAdmission(boolean allowed);

    /**
     * Expose the result cache size as a gauge.
     *
     * @param size supplier read on every scrape
     */
    void registerCacheSize(Supplier<Number> size);
}
