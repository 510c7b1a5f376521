package canopy.core.port.in;

import java.util.Optional;

import canopy.core.model.cache.CacheStats;
import canopy.core.model.estimate.FallbackStats;
import canopy.core.model.ratelimit.ClientRateLimitStatus;
import canopy.core.model.ratelimit.RateLimitStats;

/**
 * Read-only snapshots of the engine's shared state.
 */
public interface StatisticsQuery {

    CacheStats cacheStats();

    RateLimitStats rateLimitStats();

    Optional<ClientRateLimitStatus> clientRateLimitStatus(String clientId);

    FallbackStats fallbackStats();
}
