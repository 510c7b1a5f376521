package canopy.core.service.stats;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;

import canopy.core.model.estimate.FallbackStats;

/**
 * Process-wide aggregate of request outcomes.
 *
 * <p>Each top-level request is recorded exactly once, through one of
 * {@link #recordCacheHit}, {@link #recordSuccess} or {@link #recordFailure}, so
 * {@code totalRequests == successfulRequests + failedRequests} always holds.
 */
@ApplicationScoped
public class FallbackStatistics {

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long cacheHits;
    private double averageResponseMillis;
    private final Map<String, Long> providerUsage = new LinkedHashMap<>();
    private final Map<Integer, Long> levelUsage = new TreeMap<>();

    /**
     * A request answered from the result cache.
     *
     * @param latency time taken to answer
     */
    public synchronized void recordCacheHit(Duration latency) {
        countRequest(latency);
        successfulRequests++;
        cacheHits++;
    }

    /**
     * A request answered by a provider or the baseline.
     *
     * @param providerName  the answering provider
     * @param fallbackLevel its level in the default order
     * @param latency       time taken to answer
     */
    public synchronized void recordSuccess(String providerName, int fallbackLevel, Duration latency) {
        countRequest(latency);
        successfulRequests++;
        providerUsage.merge(providerName, 1L, Long::sum);
        levelUsage.merge(fallbackLevel, 1L, Long::sum);
    }

    public synchronized void recordFailure(Duration latency) {
        countRequest(latency);
        failedRequests++;
    }

    public synchronized FallbackStats snapshot() {
        return new FallbackStats(
                totalRequests,
                successfulRequests,
                failedRequests,
                cacheHits,
                averageResponseMillis,
                providerUsage,
                levelUsage);
    }

    private void countRequest(Duration latency) {
        totalRequests++;
        final var millis = latency.toNanos() / 1_000_000.0;
        averageResponseMillis += (millis - averageResponseMillis) / totalRequests;
    }
}
