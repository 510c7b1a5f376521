package canopy.adapter.out.ratelimit;

import java.util.Optional;

import canopy.core.model.ratelimit.AdmissionDecision;
import canopy.core.model.ratelimit.ClientRateLimitStatus;
import canopy.core.model.ratelimit.RateLimitStats;
import canopy.core.port.out.RateLimiter;

/**
 * A no-op rate limiter that allows all requests.
 *
 * <p>Used when rate limiting is disabled.
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final NoOpRateLimiter INSTANCE = new NoOpRateLimiter();

    private NoOpRateLimiter() {}

    /**
     * Return the singleton instance.
     *
     * @return the no-op rate limiter
     */
    public static NoOpRateLimiter getInstance() {
        return INSTANCE;
    }

    @Override
    public AdmissionDecision admit(String clientId) {
        return AdmissionDecision.allow();
    }

    @Override
    public Optional<ClientRateLimitStatus> status(String clientId) {
        return Optional.empty();
    }

    @Override
    public RateLimitStats stats() {
        return RateLimitStats.disabled();
    }

    @Override
    public boolean reset(String clientId) {
        return false;
    }

    @Override
    public void resetAll() {
        // Nothing to reset
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
