package canopy.core.model.ratelimit;

/**
 * Read-only view of one client's windows.
 */
public record ClientRateLimitStatus(
        String clientId,
        long currentRequestsMinute,
        long maxRequestsMinute,
        long currentRequestsHour,
        long maxRequestsHour) {

    public long minuteRemaining() {
        return Math.max(0, maxRequestsMinute - currentRequestsMinute);
    }

    public long hourRemaining() {
        return Math.max(0, maxRequestsHour - currentRequestsHour);
    }
}
