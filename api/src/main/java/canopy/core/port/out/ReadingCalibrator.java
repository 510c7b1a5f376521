package canopy.core.port.out;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.NutrientEstimate;
import canopy.core.model.estimate.ProviderReading;

/**
 * Port interface for the post-processing applied to a successful reading.
 *
 * <p>Implementations are pure: the same reading and request always produce the same estimate.
 */
public interface ReadingCalibrator {

    NutrientEstimate calibrate(ProviderReading reading, EstimateRequest request);
}
