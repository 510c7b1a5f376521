package canopy.core.model.ratelimit;

import java.util.Objects;

/**
 * Per-client rate limit state: one window per minute and one per hour.
 *
 * <p>Immutable; every check produces a new instance that replaces the stored one.
 *
 * @param minute the 60-second window
 * @param hour   the 3600-second window
 */
public record ClientWindowState(FixedWindow minute, FixedWindow hour) {

    public static final long MINUTE_MILLIS = 60_000L;
    public static final long HOUR_MILLIS = 3_600_000L;

    public ClientWindowState {
        Objects.requireNonNull(minute, "minute must not be null");
        Objects.requireNonNull(hour, "hour must not be null");
    }

    /**
     * Initial state for a client seen for the first time.
     *
     * @param nowMillis current time
     * @return state with both windows empty and starting now
     */
    public static ClientWindowState initial(long nowMillis) {
        return new ClientWindowState(
                FixedWindow.open(nowMillis, MINUTE_MILLIS), FixedWindow.open(nowMillis, HOUR_MILLIS));
    }

    /**
     * Resets whichever windows have elapsed.
     *
     * @param nowMillis current time
     * @return state with live windows
     */
    public ClientWindowState roll(long nowMillis) {
        final var rolledMinute = minute.roll(nowMillis, MINUTE_MILLIS);
        final var rolledHour = hour.roll(nowMillis, HOUR_MILLIS);
        if (rolledMinute == minute && rolledHour == hour) {
            return this;
        }
        return new ClientWindowState(rolledMinute, rolledHour);
    }

    /**
     * Records one admitted request in both windows.
     *
     * @return the new state
     */
    public ClientWindowState consume() {
        return new ClientWindowState(minute.increment(), hour.increment());
    }
}
