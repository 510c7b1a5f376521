package canopy.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import canopy.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import canopy.core.config.RateLimitingConfig;
import canopy.core.port.out.Metrics;
import canopy.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>When rate limiting is disabled, returns a no-op implementation.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;
    private final Clock clock;
    private final Metrics metrics;

    @Inject
    public RateLimiterProducer(RateLimitingConfig config, Clock clock, Metrics metrics) {
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled, using NoOpRateLimiter");
            return NoOpRateLimiter.getInstance();
        }

        LOG.infov(
                "Rate limiting enabled: {0}/min, {1}/hour, tracking up to {2} clients",
                config.maxPerMinute(), config.maxPerHour(), config.maxTrackedClients());
        return new InMemoryRateLimiter(
                config.maxPerMinute(),
                config.maxPerHour(),
                config.maxTrackedClients(),
                config.idleExpiry(),
                clock,
                metrics);
    }
}
