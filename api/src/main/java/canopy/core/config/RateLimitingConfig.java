package canopy.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for per-client admission control.
 *
 * <p>Configuration prefix: {@code canopy.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code CANOPY_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code CANOPY_RATE_LIMITING_MAX_PER_MINUTE} - Requests per client per 60-second window</li>
 *   <li>{@code CANOPY_RATE_LIMITING_MAX_PER_HOUR} - Requests per client per 3600-second window</li>
 * </ul>
 */
@ConfigMapping(prefix = "canopy.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * @return requests admitted per client per minute (default: 60)
     */
    @WithDefault("60")
    long maxPerMinute();

    /**
     * @return requests admitted per client per hour (default: 1000)
     */
    @WithDefault("1000")
    long maxPerHour();

    /**
     * Upper bound on client identities holding window state.
     *
     * <p>When exceeded, the least recently seen clients are dropped and start
     * over with empty windows on their next request.
     *
     * @return maximum tracked clients (default: 10000)
     */
    @WithDefault("10000")
    long maxTrackedClients();

    /**
     * Window state of a client not seen for this long is discarded.
     *
     * <p>Must be at least one hour, otherwise the hour window could be forgotten early.
     *
     * @return idle expiry (default: 2 hours)
     */
    @WithDefault("PT2H")
    Duration idleExpiry();
}
