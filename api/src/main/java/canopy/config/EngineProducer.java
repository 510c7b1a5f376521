package canopy.config;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import canopy.core.cache.ExpiringResultCache;
import canopy.core.config.CacheConfig;
import canopy.core.model.estimate.CachedEstimate;
import canopy.core.model.estimate.RequestKey;
import canopy.core.port.out.Metrics;

/**
 * Produces the shared engine state for injection into core services.
 */
@ApplicationScoped
public class EngineProducer {

    private static final Logger LOG = Logger.getLogger(EngineProducer.class);

    private final CacheConfig cacheConfig;
    private final Metrics metrics;

    @Inject
    public EngineProducer(CacheConfig cacheConfig, Metrics metrics) {
        this.cacheConfig = cacheConfig;
        this.metrics = metrics;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The process-wide estimate cache.
     *
     * @param clock time source for expiry
     * @return the cache
     */
    @Produces
    @Singleton
    public ExpiringResultCache<RequestKey, CachedEstimate> resultCache(Clock clock) {
        final var cache = new ExpiringResultCache<RequestKey, CachedEstimate>(
                cacheConfig.ttl(), cacheConfig.maxSize(), clock);
        metrics.registerCacheSize(cache::estimatedSize);
        LOG.infov("Result cache: ttl={0}, maxSize={1}", cacheConfig.ttl(), cacheConfig.maxSize());
        return cache;
    }
}
