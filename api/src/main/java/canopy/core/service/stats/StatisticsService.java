package canopy.core.service.stats;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import canopy.core.cache.ExpiringResultCache;
import canopy.core.model.cache.CacheStats;
import canopy.core.model.estimate.CachedEstimate;
import canopy.core.model.estimate.FallbackStats;
import canopy.core.model.estimate.RequestKey;
import canopy.core.model.ratelimit.ClientRateLimitStatus;
import canopy.core.model.ratelimit.RateLimitStats;
import canopy.core.port.in.MaintenanceUseCase;
import canopy.core.port.in.StatisticsQuery;
import canopy.core.port.out.RateLimiter;

/**
 * Snapshots and administration of the cache, the rate limiter and the fallback statistics.
 */
@ApplicationScoped
public class StatisticsService implements StatisticsQuery, MaintenanceUseCase {

    private static final Logger LOG = Logger.getLogger(StatisticsService.class);

    private final ExpiringResultCache<RequestKey, CachedEstimate> cache;
    private final RateLimiter rateLimiter;
    private final FallbackStatistics statistics;

    @Inject
    public StatisticsService(
            ExpiringResultCache<RequestKey, CachedEstimate> cache,
            RateLimiter rateLimiter,
            FallbackStatistics statistics) {
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.statistics = statistics;
    }

    @Override
    public CacheStats cacheStats() {
        return cache.stats();
    }

    @Override
    public RateLimitStats rateLimitStats() {
        return rateLimiter.stats();
    }

    @Override
    public Optional<ClientRateLimitStatus> clientRateLimitStatus(String clientId) {
        return rateLimiter.status(clientId);
    }

    @Override
    public FallbackStats fallbackStats() {
        return statistics.snapshot();
    }

    @Override
    public void clearCache() {
        final var size = cache.estimatedSize();
        cache.invalidateAll();
        LOG.infov("Result cache cleared, {0} entries dropped", size);
    }

    @Override
    public int purgeExpiredCache() {
        return cache.purgeExpired();
    }

    @Override
    public boolean resetClient(String clientId) {
        return rateLimiter.reset(clientId);
    }

    @Override
    public void resetAllClients() {
        rateLimiter.resetAll();
    }
}
