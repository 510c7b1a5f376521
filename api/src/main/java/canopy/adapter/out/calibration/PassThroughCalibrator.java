package canopy.adapter.out.calibration;

import jakarta.enterprise.context.ApplicationScoped;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.NutrientEstimate;
import canopy.core.model.estimate.ProviderReading;
import canopy.core.port.out.ReadingCalibrator;

/**
 * Calibrator that keeps provider values unchanged and attaches the source metadata.
 */
@ApplicationScoped
public class PassThroughCalibrator implements ReadingCalibrator {

    @Override
    public NutrientEstimate calibrate(ProviderReading reading, EstimateRequest request) {
        return new NutrientEstimate(
                reading.nutrients(),
                reading.indices(),
                reading.providerName(),
                reading.confidence(),
                reading.resolution());
    }
}
