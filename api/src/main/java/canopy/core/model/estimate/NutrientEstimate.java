package canopy.core.model.estimate;

import java.util.Map;
import java.util.Objects;

/**
 * Calibrated estimate handed back to callers and stored in the result cache.
 *
 * @param nutrients  calibrated nutrient values
 * @param indices    indices the estimate was derived from
 * @param source     provider that produced the underlying reading
 * @param confidence confidence score (0..1)
 * @param resolution nominal resolution label of the source
 */
public record NutrientEstimate(
        Map<String, Double> nutrients,
        Map<String, Double> indices,
        String source,
        double confidence,
        String resolution) {

    public NutrientEstimate {
        nutrients = nutrients == null ? Map.of() : Map.copyOf(nutrients);
        indices = indices == null ? Map.of() : Map.copyOf(indices);
        Objects.requireNonNull(source, "source must not be null");
    }
}
