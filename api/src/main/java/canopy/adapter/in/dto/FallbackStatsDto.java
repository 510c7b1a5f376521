package canopy.adapter.in.dto;

import java.util.Map;
import java.util.TreeMap;

import canopy.core.model.estimate.FallbackStats;

/**
 * DTO for fallback statistics.
 *
 * @param averageResponseTimeMs running mean latency over all requests
 * @param providerUsage         winning provider name to count, sorted by name
 * @param levelUsage            winning fallback level to count, sorted by level
 */
public record FallbackStatsDto(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long cacheHits,
        double successRatePercent,
        double cacheHitRatePercent,
        double averageResponseTimeMs,
        Map<String, Long> providerUsage,
        Map<Integer, Long> levelUsage) {

    public static FallbackStatsDto fromModel(FallbackStats stats) {
        return new FallbackStatsDto(
                stats.totalRequests(),
                stats.successfulRequests(),
                stats.failedRequests(),
                stats.cacheHits(),
                stats.successRatePercent(),
                stats.cacheHitRatePercent(),
                stats.averageResponseTime(),
                new TreeMap<>(stats.providerUsage()),
                new TreeMap<>(stats.levelUsage()));
    }
}
