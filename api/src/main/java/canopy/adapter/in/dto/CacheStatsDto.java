package canopy.adapter.in.dto;

import canopy.core.model.cache.CacheStats;

/**
 * DTO for result cache statistics.
 */
public record CacheStatsDto(
        long hits,
        long misses,
        long stores,
        long evictions,
        long currentSize,
        long maxSize,
        long ttlSeconds,
        double hitRatePercent) {

    public static CacheStatsDto fromModel(CacheStats stats) {
        return new CacheStatsDto(
                stats.hits(),
                stats.misses(),
                stats.stores(),
                stats.evictions(),
                stats.currentSize(),
                stats.maxSize(),
                stats.ttl().toSeconds(),
                stats.hitRatePercent());
    }
}
