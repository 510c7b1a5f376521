package canopy.core.model.estimate;

import java.util.Map;

/**
 * Snapshot of process-wide fallback statistics.
 *
 * <p>Counters are monotonic; rates are derived from them on read.
 *
 * @param totalRequests       top-level requests handled
 * @param successfulRequests  requests answered (cache, provider or baseline)
 * @param failedRequests      requests that ended in a chain exhaustion or unexpected failure
 * @param cacheHits           requests answered from the result cache
 * @param averageResponseTime running mean latency over all requests, in milliseconds
 * @param providerUsage       winning provider name to count
 * @param levelUsage          winning fallback level to count
 */
public record FallbackStats(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long cacheHits,
        double averageResponseTime,
        Map<String, Long> providerUsage,
        Map<Integer, Long> levelUsage) {

    public FallbackStats {
        providerUsage = Map.copyOf(providerUsage);
        levelUsage = Map.copyOf(levelUsage);
    }

    /**
     * Share of requests that were answered.
     *
     * @return success rate in percent, 0 when no requests were handled
     */
    public double successRatePercent() {
        return totalRequests == 0 ? 0.0 : (successfulRequests * 100.0) / totalRequests;
    }

    /**
     * Share of requests answered from the cache.
     *
     * @return cache hit rate in percent, 0 when no requests were handled
     */
    public double cacheHitRatePercent() {
        return totalRequests == 0 ? 0.0 : (cacheHits * 100.0) / totalRequests;
    }
}
