package canopy.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.jboss.logging.Logger;

import canopy.core.model.ratelimit.AdmissionDecision;
import canopy.core.model.ratelimit.ClientRateLimitStatus;
import canopy.core.model.ratelimit.ClientWindowState;
import canopy.core.model.ratelimit.RateLimitStats;
import canopy.core.port.out.Metrics;
import canopy.core.port.out.RateLimiter;
import canopy.core.util.ClientIdHash;

/**
 * In-memory two-window rate limiter.
 *
 * <p>
 * Each client holds a 60-second and a 3600-second fixed window. A request is
 * admitted only when both windows have budget left, and admission counts
 * against both. Windows reset lazily on the first check after they end.
 *
 * <p>
 * Per-client state lives in a bounded Caffeine cache: the least recently seen
 * clients are dropped beyond {@code maxTrackedClients}, and clients idle for
 * longer than {@code idleExpiry} are forgotten.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimiter.class);

    private final Cache<String, ClientWindowState> states;
    private final long maxPerMinute;
    private final long maxPerHour;
    private final Clock clock;
    private final Metrics metrics;

    private final LongAdder admitted = new LongAdder();
    private final LongAdder denied = new LongAdder();

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param maxPerMinute      requests per client per minute
     * @param maxPerHour        requests per client per hour
     * @param maxTrackedClients bound on clients holding state
     * @param idleExpiry        state of a client idle this long is dropped
     * @param clock             time source for windows
     * @param metrics           admission metrics
     */
    public InMemoryRateLimiter(
            long maxPerMinute,
            long maxPerHour,
            long maxTrackedClients,
            Duration idleExpiry,
            Clock clock,
            Metrics metrics) {
        if (maxPerMinute < 1 || maxPerHour < 1) {
            throw new IllegalArgumentException("Limits must be positive");
        }
        this.maxPerMinute = maxPerMinute;
        this.maxPerHour = maxPerHour;
        this.clock = clock;
        this.metrics = metrics;
        this.states = Caffeine.newBuilder()
                .maximumSize(maxTrackedClients)
                .expireAfterAccess(idleExpiry)
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public AdmissionDecision admit(String clientId) {
        final var nowMillis = clock.millis();

        // Atomic compute to handle concurrent requests from one client
        final var result = new AdmissionDecision[1];
        states.asMap().compute(clientId, (k, current) -> {
            final var live = current == null ? ClientWindowState.initial(nowMillis) : current.roll(nowMillis);
            final var decision = decide(live, nowMillis);
            result[0] = decision;
            return decision.allowed() ? live.consume() : live;
        });

        final var decision = result[0];
        if (decision.allowed()) {
            admitted.increment();
        } else {
            denied.increment();
            LOG.warnv(
                    "Rate limit exceeded for client {0}, retry after {1}s",
                    ClientIdHash.forLog(clientId), decision.retryAfterSeconds());
        }
        metrics.recordAdmission(decision.allowed());
        return decision;
    }

    private AdmissionDecision decide(ClientWindowState state, long nowMillis) {
        final var minute = state.minute();
        final var hour = state.hour();
        if (minute.hasBudget(maxPerMinute) && hour.hasBudget(maxPerHour)) {
            return AdmissionDecision.allowed(
                    maxPerMinute - minute.count() - 1, maxPerHour - hour.count() - 1);
        }
        final var waitMillis = Math.min(minute.millisUntilReset(nowMillis), hour.millisUntilReset(nowMillis));
        final var retryAfterSeconds = Math.max(0, (waitMillis + 999) / 1000);
        return AdmissionDecision.denied(
                retryAfterSeconds,
                Math.max(0, maxPerMinute - minute.count()),
                Math.max(0, maxPerHour - hour.count()));
    }

    @Override
    public Optional<ClientRateLimitStatus> status(String clientId) {
        final var nowMillis = clock.millis();
        return Optional.ofNullable(states.policy().getIfPresentQuietly(clientId))
                .map(state -> new ClientRateLimitStatus(
                        clientId,
                        state.minute().countAt(nowMillis),
                        maxPerMinute,
                        state.hour().countAt(nowMillis),
                        maxPerHour));
    }

    @Override
    public RateLimitStats stats() {
        final var admittedCount = admitted.sum();
        final var deniedCount = denied.sum();
        return new RateLimitStats(
                admittedCount + deniedCount,
                admittedCount,
                deniedCount,
                states.estimatedSize(),
                maxPerMinute,
                maxPerHour);
    }

    @Override
    public boolean reset(String clientId) {
        final var removed = states.asMap().remove(clientId) != null;
        if (removed) {
            LOG.infov("Rate limit state reset for client {0}", ClientIdHash.forLog(clientId));
        }
        return removed;
    }

    @Override
    public void resetAll() {
        states.invalidateAll();
        LOG.info("Rate limit state reset for all clients");
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    /**
     * Runs pending maintenance such as idle expiry.
     *
     * <p>
     * Primarily for testing purposes.
     */
    public void cleanUp() {
        states.cleanUp();
    }

    // Caffeine tickers count nanoseconds from an arbitrary origin; epoch nanos would overflow a long.
    private static Ticker clockTicker(Clock clock) {
        final var originMillis = clock.millis();
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis() - originMillis);
    }
}
