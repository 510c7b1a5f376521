package canopy.core.service.fallback;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import canopy.core.exception.ProviderException;
import canopy.core.exception.ProviderInvalidResponseException;
import canopy.core.exception.ProviderTimeoutException;
import canopy.core.exception.ProviderUnavailableException;
import canopy.core.model.estimate.AttemptOutcome;
import canopy.core.model.estimate.AttemptRecord;
import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.ProviderReading;
import canopy.core.port.out.Metrics;

/**
 * Runs the attempts against one provider for one request.
 *
 * <p>Each attempt is bounded by the provider's timeout, scaled by the request's
 * timeout factor. A failed attempt is retried
 * against the same provider up to its retry budget, waiting an exponentially growing
 * backoff in between. Every physical attempt is recorded.
 */
final class AttemptRunner {

    private static final Logger LOG = Logger.getLogger(AttemptRunner.class);

    private final Clock clock;
    private final Metrics metrics;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    AttemptRunner(Clock clock, Metrics metrics, Duration initialBackoff, Duration maxBackoff) {
        this.clock = clock;
        this.metrics = metrics;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Attempts with retries.
     *
     * @param link    the provider
     * @param request the request
     * @param log     where attempts are recorded
     * @return the reading, or the last attempt's {@link ProviderException}
     */
    Uni<ProviderReading> run(ProviderChain.Link link, EstimateRequest request, AttemptLog log) {
        return run(link, request, log, 1.0);
    }

    /**
     * Attempts with retries, each attempt bounded by the scaled provider timeout.
     *
     * @param link          the provider
     * @param request       the request
     * @param log           where attempts are recorded
     * @param timeoutFactor scale applied to the provider's attempt timeout
     * @return the reading, or the last attempt's {@link ProviderException}
     */
    Uni<ProviderReading> run(ProviderChain.Link link, EstimateRequest request, AttemptLog log, double timeoutFactor) {
        final var timeout = scale(link.descriptor().perAttemptTimeout(), timeoutFactor);
        final var attemptNumber = new AtomicInteger();
        final var attempts = Uni.createFrom()
                .deferred(() -> attemptOnce(link, request, log, timeout, attemptNumber.incrementAndGet()));

        final var maxRetries = link.descriptor().maxRetries();
        if (maxRetries == 0) {
            return attempts;
        }
        if (initialBackoff.isZero()) {
            return attempts.onFailure(ProviderException.class).retry().atMost(maxRetries);
        }
        return attempts.onFailure(ProviderException.class)
                .retry()
                .withBackOff(initialBackoff, maxBackoff)
                .withJitter(0.0)
                .atMost(maxRetries);
    }

    private Uni<ProviderReading> attemptOnce(
            ProviderChain.Link link, EstimateRequest request, AttemptLog log, Duration timeout, int attemptNumber) {
        final var name = link.name();
        final var startedAt = clock.instant();
        final var startNanos = System.nanoTime();
        LOG.debugv("Attempt {0} against provider {1}", attemptNumber, name);

        return Uni.createFrom()
                .deferred(() -> link.provider().fetch(request, startedAt.plus(timeout)))
                .onItem()
                .ifNull()
                .failWith(() -> new ProviderInvalidResponseException(name, "Provider returned no reading"))
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new ProviderTimeoutException(name, timeout))
                .onFailure(failure -> !(failure instanceof ProviderException))
                .transform(failure -> new ProviderUnavailableException(name, describe(failure), failure))
                .onItemOrFailure()
                .invoke((reading, failure) -> {
                    final var latency = Duration.ofNanos(System.nanoTime() - startNanos);
                    final var outcome = outcomeOf(failure);
                    final var detail = failure == null ? "" : failure.getMessage();
                    if (log.record(new AttemptRecord(name, attemptNumber, startedAt, outcome, latency, detail))) {
                        metrics.recordAttempt(name, outcome, latency.toMillis());
                        if (failure != null) {
                            LOG.warnv("Provider {0} attempt {1} failed: {2}", name, attemptNumber, detail);
                        }
                    }
                });
    }

    static Duration scale(Duration timeout, double factor) {
        if (factor == 1.0) {
            return timeout;
        }
        return Duration.ofMillis(Math.max(1L, Math.round(timeout.toMillis() * factor)));
    }

    private static AttemptOutcome outcomeOf(Throwable failure) {
        if (failure == null) {
            return AttemptOutcome.SUCCESS;
        }
        return failure instanceof ProviderTimeoutException ? AttemptOutcome.TIMEOUT : AttemptOutcome.ERROR;
    }

    private static String describe(Throwable failure) {
        final var message = failure.getMessage();
        return message == null ? failure.getClass().getSimpleName() : message;
    }
}
