package canopy.core.model.ratelimit;

/**
 * Result of an admission check.
 *
 * @param allowed           whether the request may proceed
 * @param retryAfterSeconds seconds until the client may retry (0 when allowed)
 * @param minuteRemaining   budget left in the minute window after this check
 * @param hourRemaining     budget left in the hour window after this check
 */
public record AdmissionDecision(boolean allowed, long retryAfterSeconds, long minuteRemaining, long hourRemaining) {

    public AdmissionDecision {
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be non-negative");
        }
    }

    /**
     * Unconditional admission, used when rate limiting is disabled.
     *
     * @return an allowed decision with unlimited budget
     */
    public static AdmissionDecision allow() {
        return new AdmissionDecision(true, 0, Long.MAX_VALUE, Long.MAX_VALUE);
    }

    public static AdmissionDecision allowed(long minuteRemaining, long hourRemaining) {
        return new AdmissionDecision(true, 0, minuteRemaining, hourRemaining);
    }

    public static AdmissionDecision denied(long retryAfterSeconds, long minuteRemaining, long hourRemaining) {
        return new AdmissionDecision(false, retryAfterSeconds, minuteRemaining, hourRemaining);
    }
}
