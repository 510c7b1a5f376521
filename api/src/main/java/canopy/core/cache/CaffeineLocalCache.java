package canopy.core.cache;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Bounded memo for weather conditions, keyed by rounded location and date.
 *
 * <p>Entries live for a fixed time after they are written. Past the size bound
 * Caffeine evicts by its own frequency policy.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> entries;

    public CaffeineLocalCache(Duration ttl, long maxEntries) {
        this(ttl, maxEntries, Ticker.systemTicker());
    }

    public CaffeineLocalCache(Duration ttl, long maxEntries, Ticker ticker) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        entries.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        entries.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        entries.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return entries.estimatedSize();
    }
}
