package canopy.adapter.in.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import canopy.core.model.estimate.AttemptOutcome;
import canopy.core.model.estimate.AttemptRecord;
import canopy.core.model.estimate.EstimateResult;
import canopy.core.model.estimate.NutrientEstimate;

@DisplayName("EstimateResponse")
class EstimateResponseTest {

    private static final Instant STARTED = Instant.parse("2024-06-01T10:00:00Z");

    @Test
    @DisplayName("should flatten the result and its attempts")
    void shouldFlattenResult() {
        var estimate = new NutrientEstimate(Map.of("nitrogen", 231.0), Map.of("ndvi", 0.58), "landsat", 0.9, "30m");
        var attempts = List.of(
                new AttemptRecord(
                        "sentinel2", 1, STARTED, AttemptOutcome.TIMEOUT, Duration.ofSeconds(30), "timed out"),
                new AttemptRecord(
                        "landsat", 1, STARTED.plusSeconds(30), AttemptOutcome.SUCCESS, Duration.ofMillis(850), ""));
        var result = new EstimateResult(
                estimate, "landsat", 2, false, attempts, "High-value crop", Duration.ofMillis(30_900));

        var response = EstimateResponse.fromModel(result);

        assertEquals(Map.of("nitrogen", 231.0), response.nutrients());
        assertEquals("landsat", response.source());
        assertEquals(2, response.fallbackLevel());
        assertEquals(0.9, response.confidence());
        assertEquals("30m", response.resolution());
        assertEquals("High-value crop", response.selectionReason());
        assertEquals(30_900, response.totalLatencyMs());
        assertEquals(2, response.attempts().size());
        var first = response.attempts().get(0);
        assertEquals("sentinel2", first.provider());
        assertEquals("TIMEOUT", first.outcome());
        assertEquals("2024-06-01T10:00:00Z", first.startedAt());
        assertEquals(30_000, first.latencyMs());
        assertEquals("timed out", first.detail());
    }

    @Test
    @DisplayName("should report cache hits without attempts")
    void shouldReportCacheHits() {
        var estimate = new NutrientEstimate(Map.of("nitrogen", 245.0), Map.of(), "sentinel2", 0.95, "10m");
        var result = new EstimateResult(estimate, "sentinel2", 1, true, List.of(), "", Duration.ofMillis(2));

        var response = EstimateResponse.fromModel(result);

        assertTrue(response.fromCache());
        assertTrue(response.attempts().isEmpty());
    }
}
