package canopy.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import org.jboss.logging.Logger;

import canopy.core.model.cache.CacheStats;

/**
 * Bounded TTL cache with deterministic eviction and exact statistics.
 *
 * <p>Every entry lives for the same fixed TTL. Expiry is lazy: an entry past its
 * expiry is treated as absent by {@link #get} and removed at that point, or
 * earlier by {@link #purgeExpired()}. An entry is expired once {@code now} is
 * strictly after its expiry instant.
 *
 * <p>When a new key arrives at capacity, the resident entry with the earliest
 * expiry is evicted first; entries with the same expiry leave in insertion order.
 *
 * <p>Counters:
 * <ul>
 *   <li>every {@code get} increments exactly one of hits or misses</li>
 *   <li>a {@code put} of a key with no live entry increments stores</li>
 *   <li>a {@code put} over a live entry replaces value and expiry and touches no counter</li>
 *   <li>capacity evictions and purged expired entries increment evictions</li>
 * </ul>
 *
 * <p>Thread-safe. Reads and writes of unrelated keys do not contend on a shared lock;
 * the capacity bound is held with a reservation counter.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class ExpiringResultCache<K, V> implements LocalCache<K, V> {

    private static final Logger LOG = Logger.getLogger(ExpiringResultCache.class);

    private static final Comparator<Entry<?, ?>> EXPIRY_ORDER =
            Comparator.<Entry<?, ?>, Instant>comparing(e -> e.expiresAt).thenComparingLong(e -> e.sequence);

    private final ConcurrentMap<K, Entry<K, V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentSkipListSet<Entry<K, V>> expiryOrder = new ConcurrentSkipListSet<>(EXPIRY_ORDER);
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicLong sequence = new AtomicLong();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder stores = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;

    /**
     * Creates a cache.
     *
     * @param ttl     lifetime of every entry, must be positive
     * @param maxSize capacity, must be at least 1
     * @param clock   time source for expiry
     */
    public ExpiringResultCache(Duration ttl, int maxSize, Clock clock) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got: " + maxSize);
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<V> get(K key) {
        Optional<V> found;
        try {
            found = lookup(key, clock.instant());
        } catch (RuntimeException e) {
            LOG.warnv(e, "Cache lookup failed, treating as miss: {0}", e.getMessage());
            found = Optional.empty();
        }
        if (found.isPresent()) {
            hits.increment();
        } else {
            misses.increment();
        }
        return found;
    }

    private Optional<V> lookup(K key, Instant now) {
        final var entry = entries.get(key);
        if (entry == null) {
            LOG.debugv("Cache miss: {0}", key);
            return Optional.empty();
        }
        if (entry.isExpiredAt(now)) {
            discard(entry);
            LOG.debugv("Cache miss (expired): {0}", key);
            return Optional.empty();
        }
        LOG.debugv("Cache hit: {0}", key);
        return Optional.of(entry.value);
    }

    @Override
    public void put(K key, V value) {
        try {
            store(key, value, clock.instant());
        } catch (RuntimeException e) {
            LOG.warnv(e, "Cache store failed, entry dropped: {0}", e.getMessage());
        }
    }

    private void store(K key, V value, Instant now) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        final var created = new Entry<>(key, value, now.plus(ttl), sequence.incrementAndGet());

        while (true) {
            final var existing = entries.get(key);
            if (existing != null && !existing.isExpiredAt(now)) {
                if (entries.replace(key, existing, created)) {
                    expiryOrder.remove(existing);
                    expiryOrder.add(created);
                    return;
                }
                continue;
            }
            if (existing != null) {
                discard(existing);
                continue;
            }

            reserveSlot();
            if (entries.putIfAbsent(key, created) == null) {
                expiryOrder.add(created);
                stores.increment();
                return;
            }
            size.decrementAndGet();
        }
    }

    private void reserveSlot() {
        while (true) {
            final var current = size.get();
            if (current < maxSize) {
                if (size.compareAndSet(current, current + 1)) {
                    return;
                }
            } else if (!evictOne()) {
                // a concurrent writer holds a reservation but has not published its entry yet
                Thread.onSpinWait();
            }
        }
    }

    private boolean evictOne() {
        Entry<K, V> candidate;
        while ((candidate = expiryOrder.pollFirst()) != null) {
            if (entries.remove(candidate.key, candidate)) {
                size.decrementAndGet();
                evictions.increment();
                LOG.debugv("Cache eviction: {0}", candidate.key);
                return true;
            }
        }
        return false;
    }

    private boolean discard(Entry<K, V> entry) {
        if (entries.remove(entry.key, entry)) {
            expiryOrder.remove(entry);
            size.decrementAndGet();
            return true;
        }
        return false;
    }

    @Override
    public void invalidate(K key) {
        final var entry = entries.get(key);
        if (entry != null) {
            discard(entry);
        }
    }

    @Override
    public void invalidateAll() {
        for (final var entry : entries.values()) {
            discard(entry);
        }
    }

    /**
     * Removes every entry already past its expiry.
     *
     * <p>Each purged entry counts as an eviction.
     *
     * @return number of entries purged
     */
    public int purgeExpired() {
        final var now = clock.instant();
        var purged = 0;
        for (final var entry : expiryOrder) {
            if (!entry.isExpiredAt(now)) {
                break;
            }
            if (discard(entry)) {
                evictions.increment();
                purged++;
            } else {
                expiryOrder.remove(entry);
            }
        }
        if (purged > 0) {
            LOG.debugv("Purged {0} expired cache entries", purged);
        }
        return purged;
    }

    @Override
    public long estimatedSize() {
        return size.get();
    }

    /**
     * Snapshot of the cache counters.
     *
     * @return current statistics
     */
    public CacheStats stats() {
        return new CacheStats(
                hits.sum(), misses.sum(), stores.sum(), evictions.sum(), size.get(), maxSize, ttl);
    }

    // Identity equality: a replaced entry must never match its successor.
    private static final class Entry<K, V> {
        private final K key;
        private final V value;
        private final Instant expiresAt;
        private final long sequence;

        private Entry(K key, V value, Instant expiresAt, long sequence) {
            this.key = key;
            this.value = value;
            this.expiresAt = expiresAt;
            this.sequence = sequence;
        }

        private boolean isExpiredAt(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
