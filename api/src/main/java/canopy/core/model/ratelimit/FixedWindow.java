package canopy.core.model.ratelimit;

/**
 * Fixed-window counter.
 *
 * <p>A window starts at the first check after the previous one expired and lasts
 * {@code windowMillis}. Resets are lazy: they happen when a check observes that
 * {@code resetAtMillis} has been reached, never on a timer.
 *
 * @param count         requests admitted in the current window
 * @param resetAtMillis epoch millis at which the window ends
 */
public record FixedWindow(long count, long resetAtMillis) {

    public FixedWindow {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
    }

    /**
     * Opens an empty window at {@code nowMillis}.
     *
     * @param nowMillis    current time
     * @param windowMillis window length
     * @return the new window
     */
    public static FixedWindow open(long nowMillis, long windowMillis) {
        return new FixedWindow(0, nowMillis + windowMillis);
    }

    public boolean isElapsed(long nowMillis) {
        return nowMillis >= resetAtMillis;
    }

    /**
     * Returns this window, or a fresh one starting now if this one has elapsed.
     *
     * @param nowMillis    current time
     * @param windowMillis window length
     * @return the live window
     */
    public FixedWindow roll(long nowMillis, long windowMillis) {
        return isElapsed(nowMillis) ? open(nowMillis, windowMillis) : this;
    }

    public FixedWindow increment() {
        return new FixedWindow(count + 1, resetAtMillis);
    }

    public boolean hasBudget(long limit) {
        return count < limit;
    }

    /**
     * Count as seen by an observer at {@code nowMillis}, without rolling the window.
     *
     * @param nowMillis current time
     * @return 0 if the window has elapsed, otherwise the count
     */
    public long countAt(long nowMillis) {
        return isElapsed(nowMillis) ? 0 : count;
    }

    public long millisUntilReset(long nowMillis) {
        return Math.max(0, resetAtMillis - nowMillis);
    }
}
