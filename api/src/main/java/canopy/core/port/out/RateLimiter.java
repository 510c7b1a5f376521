package canopy.core.port.out;

import java.util.Optional;

import canopy.core.model.ratelimit.AdmissionDecision;
import canopy.core.model.ratelimit.ClientRateLimitStatus;
import canopy.core.model.ratelimit.RateLimitStats;

/**
 * Port interface for per-client admission control.
 *
 * <p>Unlike provider calls, admission checks are synchronous and non-blocking:
 * they only touch in-process state.
 */
public interface RateLimiter {

    /**
     * Check whether a request from the client may proceed and record it if so.
     *
     * <p>Atomic per client: concurrent checks for one client are applied one after another.
     *
     * @param clientId the client identity
     * @return the decision
     */
    AdmissionDecision admit(String clientId);

    /**
     * Current window counts for a client, without recording a request.
     *
     * @param clientId the client identity
     * @return the status, empty if the client has no state
     */
    Optional<ClientRateLimitStatus> status(String clientId);

    /**
     * @return process-wide admission statistics
     */
    RateLimitStats stats();

    /**
     * Discard a client's window state.
     *
     * <p>This is typically used for administrative purposes or testing.
     *
     * @param clientId the client identity
     * @return true if state existed
     */
    boolean reset(String clientId);

    /**
     * Discard every client's window state. Statistics are kept.
     */
    void resetAll();

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    boolean isEnabled();
}
