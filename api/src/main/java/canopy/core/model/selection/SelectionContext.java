package canopy.core.model.selection;

import java.util.Objects;

/**
 * Request-scoped facts used to reorder the provider chain. Never persisted.
 *
 * @param weather        current weather at the location
 * @param remoteness     reference data coverage
 * @param value          value class of the use case
 * @param growthRate     growth rate class of the crop
 * @param inPriorityArea whether the location lies in a configured priority area
 */
public record SelectionContext(
        WeatherCondition weather,
        RemotenessClass remoteness,
        ValueClass value,
        GrowthRateClass growthRate,
        boolean inPriorityArea) {

    public SelectionContext {
        Objects.requireNonNull(weather, "weather must not be null");
        Objects.requireNonNull(remoteness, "remoteness must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(growthRate, "growthRate must not be null");
    }

    public SelectionContext(
            WeatherCondition weather, RemotenessClass remoteness, ValueClass value, GrowthRateClass growthRate) {
        this(weather, remoteness, value, growthRate, false);
    }

    /**
     * Context in which no reordering rule applies.
     *
     * @return the neutral context
     */
    public static SelectionContext neutral() {
        return new SelectionContext(
                WeatherCondition.UNKNOWN, RemotenessClass.WELL_COVERED, ValueClass.STANDARD, GrowthRateClass.NORMAL);
    }
}
