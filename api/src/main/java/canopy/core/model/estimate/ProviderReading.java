package canopy.core.model.estimate;

import java.util.Map;
import java.util.Objects;

/**
 * Raw reading returned by a provider before calibration.
 *
 * @param providerName the provider that produced it
 * @param nutrients    nutrient values keyed by nutrient name
 * @param indices      vegetation/soil indices keyed by index name
 * @param confidence   nominal confidence of the source (0..1)
 * @param resolution   nominal resolution label (e.g. {@code 10m}, {@code village-level})
 */
public record ProviderReading(
        String providerName,
        Map<String, Double> nutrients,
        Map<String, Double> indices,
        double confidence,
        String resolution) {

    public ProviderReading {
        Objects.requireNonNull(providerName, "providerName must not be null");
        nutrients = nutrients == null ? Map.of() : Map.copyOf(nutrients);
        indices = indices == null ? Map.of() : Map.copyOf(indices);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0 and 1, got: " + confidence);
        }
        resolution = resolution == null ? "unknown" : resolution;
    }
}
