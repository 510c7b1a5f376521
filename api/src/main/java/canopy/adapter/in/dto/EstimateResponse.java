package canopy.adapter.in.dto;

import java.util.List;
import java.util.Map;

import canopy.core.model.estimate.AttemptRecord;
import canopy.core.model.estimate.EstimateResult;

/**
 * DTO for estimate responses.
 *
 * @param nutrients       calibrated nutrient values
 * @param indices         indices the estimate was derived from
 * @param source          provider whose answer was used
 * @param fallbackLevel   level of that provider in the default chain
 * @param confidence      confidence score of the source
 * @param resolution      nominal resolution of the source
 * @param fromCache       whether the answer came from the result cache
 * @param selectionReason why the provider order was chosen
 * @param totalLatencyMs  handling time in milliseconds
 * @param attempts        provider attempts made for this request
 */
public record EstimateResponse(
        Map<String, Double> nutrients,
        Map<String, Double> indices,
        String source,
        int fallbackLevel,
        double confidence,
        String resolution,
        boolean fromCache,
        String selectionReason,
        long totalLatencyMs,
        List<Attempt> attempts) {

    /**
     * One provider attempt.
     *
     * @param provider      provider name
     * @param attemptNumber 1-based attempt number, 0 when skipped
     * @param startedAt     ISO-8601 start instant
     * @param outcome       SUCCESS, TIMEOUT, ERROR or SKIPPED
     * @param latencyMs     attempt latency in milliseconds
     * @param detail        failure detail
     */
    public record Attempt(
            String provider, int attemptNumber, String startedAt, String outcome, long latencyMs, String detail) {

        static Attempt fromModel(AttemptRecord attempt) {
            return new Attempt(
                    attempt.providerName(),
                    attempt.attemptNumber(),
                    attempt.startedAt().toString(),
                    attempt.outcome().name(),
                    attempt.latency().toMillis(),
                    attempt.detail());
        }
    }

    public static EstimateResponse fromModel(EstimateResult result) {
        final var estimate = result.estimate();
        return new EstimateResponse(
                estimate.nutrients(),
                estimate.indices(),
                result.providerName(),
                result.fallbackLevel(),
                estimate.confidence(),
                estimate.resolution(),
                result.fromCache(),
                result.selectionReason(),
                result.totalLatency().toMillis(),
                result.attempts().stream().map(Attempt::fromModel).toList());
    }
}
