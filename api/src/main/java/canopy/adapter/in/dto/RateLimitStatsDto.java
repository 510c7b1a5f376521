package canopy.adapter.in.dto;

import canopy.core.model.ratelimit.RateLimitStats;

/**
 * DTO for global rate limiting statistics.
 *
 * @param enabled whether admission control is active
 */
public record RateLimitStatsDto(
        boolean enabled,
        long totalChecks,
        long admitted,
        long denied,
        double denialRatePercent,
        long trackedClients,
        long maxPerMinute,
        long maxPerHour) {

    public static RateLimitStatsDto fromModel(RateLimitStats stats, boolean enabled) {
        return new RateLimitStatsDto(
                enabled,
                stats.totalChecks(),
                stats.admitted(),
                stats.denied(),
                stats.denialRatePercent(),
                stats.trackedClients(),
                stats.maxPerMinute(),
                stats.maxPerHour());
    }
}
