package canopy.adapter.out.baseline;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import canopy.core.config.BaselineConfig;
import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.ProviderReading;
import canopy.core.port.out.BaselineEstimator;

/**
 * Baseline estimator answering with configured regional soil averages.
 *
 * <p>Never touches the network, so it cannot fail for the reasons providers do.
 */
@ApplicationScoped
public class RegionalBaselineEstimator implements BaselineEstimator {

    static final String RESOLUTION = "regional-average";

    private final ProviderReading reading;

    @Inject
    public RegionalBaselineEstimator(BaselineConfig config) {
        this.reading = new ProviderReading(
                NAME,
                Map.of(
                        "nitrogen", config.nitrogen(),
                        "phosphorus", config.phosphorus(),
                        "potassium", config.potassium(),
                        "ph", config.ph()),
                Map.of(),
                config.confidence(),
                RESOLUTION);
    }

    @Override
    public ProviderReading estimate(EstimateRequest request) {
        return reading;
    }
}
