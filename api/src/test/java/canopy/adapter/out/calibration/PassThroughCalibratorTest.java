package canopy.adapter.out.calibration;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.estimate.ProviderReading;

@DisplayName("PassThroughCalibrator")
class PassThroughCalibratorTest {

    @Test
    @DisplayName("should keep values and carry the source metadata")
    void shouldKeepValuesAndMetadata() {
        var reading = new ProviderReading("landsat", Map.of("nitrogen", 231.0), Map.of("ndvi", 0.58), 0.9, "30m");
        var request = EstimateRequest.of(new GeoPoint(21.25, 81.63), LocalDate.of(2024, 6, 1), "rice");

        var estimate = new PassThroughCalibrator().calibrate(reading, request);

        assertEquals(Map.of("nitrogen", 231.0), estimate.nutrients());
        assertEquals(Map.of("ndvi", 0.58), estimate.indices());
        assertEquals("landsat", estimate.source());
        assertEquals(0.9, estimate.confidence());
        assertEquals("30m", estimate.resolution());
    }
}
