package canopy.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the estimate result cache.
 *
 * <p>Configuration prefix: {@code canopy.cache}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code canopy.cache.ttl} - Lifetime of every cached estimate</li>
 *   <li>{@code canopy.cache.max-size} - Capacity; the entry nearest to expiry is evicted first</li>
 *   <li>{@code canopy.cache.key-precision} - Decimal places kept from coordinates in cache keys</li>
 *   <li>{@code canopy.cache.purge-interval} - How often expired entries are dropped in the background</li>
 * </ul>
 */
@ConfigMapping(prefix = "canopy.cache")
public interface CacheConfig {

    /**
     * Time-to-live applied to every entry.
     *
     * @return TTL duration (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration ttl();

    /**
     * Maximum number of resident entries.
     *
     * @return capacity (default: 1000)
     */
    @WithDefault("1000")
    int maxSize();

    /**
     * Decimal places of latitude and longitude kept in the cache key.
     *
     * <p>Four places is roughly 11 metres, finer than any provider's resolution.
     * More precision than that splits requests for the same pixel into separate entries.
     *
     * @return decimal places (default: 4)
     */
    @WithDefault("4")
    int keyPrecision();

    /**
     * Interval of the background purge of expired entries.
     *
     * @return purge interval (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration purgeInterval();
}
