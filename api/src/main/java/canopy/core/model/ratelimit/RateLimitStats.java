package canopy.core.model.ratelimit;

/**
 * Process-wide admission statistics.
 *
 * @param totalChecks    admission checks performed
 * @param admitted       checks that admitted the request
 * @param denied         checks that denied the request
 * @param trackedClients client identities currently holding state
 * @param maxPerMinute   configured minute limit
 * @param maxPerHour     configured hour limit
 */
public record RateLimitStats(
        long totalChecks, long admitted, long denied, long trackedClients, long maxPerMinute, long maxPerHour) {

    public static RateLimitStats disabled() {
        return new RateLimitStats(0, 0, 0, 0, Long.MAX_VALUE, Long.MAX_VALUE);
    }

    public double denialRatePercent() {
        return totalChecks == 0 ? 0.0 : (denied * 100.0) / totalChecks;
    }
}
