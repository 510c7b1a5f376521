package canopy.core.model.estimate;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One physical attempt against a provider.
 *
 * @param providerName  provider attempted
 * @param attemptNumber 1-based attempt number for that provider within the request (0 for skipped)
 * @param startedAt     when the attempt started
 * @param outcome       how it ended
 * @param latency       time spent in the attempt
 * @param detail        failure detail, empty on success
 */
public record AttemptRecord(
        String providerName,
        int attemptNumber,
        Instant startedAt,
        AttemptOutcome outcome,
        Duration latency,
        String detail) {

    public AttemptRecord {
        Objects.requireNonNull(providerName, "providerName must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        latency = Objects.requireNonNullElse(latency, Duration.ZERO);
        detail = detail == null ? "" : detail;
    }

    public static AttemptRecord skipped(String providerName, Instant at, String reason) {
        return new AttemptRecord(providerName, 0, at, AttemptOutcome.SKIPPED, Duration.ZERO, reason);
    }
}
