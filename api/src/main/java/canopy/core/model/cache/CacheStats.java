package canopy.core.model.cache;

import java.time.Duration;

/**
 * Snapshot of result cache statistics.
 *
 * <p>All counters are monotonic for the lifetime of the cache; only
 * {@code currentSize} goes down.
 *
 * @param hits        lookups answered with a live entry
 * @param misses      lookups that found nothing live
 * @param stores      puts that added a new live key
 * @param evictions   entries removed to make room or purged after expiry
 * @param currentSize entries physically resident
 * @param maxSize     capacity
 * @param ttl         time-to-live applied to every entry
 */
public record CacheStats(
        long hits, long misses, long stores, long evictions, long currentSize, long maxSize, Duration ttl) {

    public double hitRatePercent() {
        final var lookups = hits + misses;
        return lookups == 0 ? 0.0 : (hits * 100.0) / lookups;
    }
}
