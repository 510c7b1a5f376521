package canopy.core.model.selection;

import java.util.Locale;

/**
 * Coarse weather condition at a location on a date.
 */
public enum WeatherCondition {
    CLEAR,
    PARTLY_CLOUDY,
    OVERCAST,
    RAIN,
    STORM,
    UNKNOWN;

    /**
     * Whether optical sensors are likely blind under this condition.
     *
     * @return true for overcast, rain and storm
     */
    public boolean isHeavyCloudOrPrecipitation() {
        return this == OVERCAST || this == RAIN || this == STORM;
    }

    /**
     * Whether the condition is rain or storm.
     *
     * @return true for rain and storm
     */
    public boolean isHeavyPrecipitation() {
        return this == RAIN || this == STORM;
    }

    /**
     * Scale applied to provider attempt timeouts under this condition.
     *
     * @return 1.5 for overcast, rain and storm, 0.8 for clear, 1.0 otherwise
     */
    public double attemptTimeoutFactor() {
        if (isHeavyCloudOrPrecipitation()) {
            return 1.5;
        }
        return this == CLEAR ? 0.8 : 1.0;
    }

    /**
     * Lenient parse of upstream/caller supplied condition names.
     *
     * <p>Accepts the enum names plus common synonyms ({@code cloudy}, {@code rainy},
     * {@code heavy_rain}, {@code sunny}). Anything else maps to {@link #UNKNOWN}.
     *
     * @param value the raw value, may be null
     * @return the condition
     */
    public static WeatherCondition parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "SUNNY" -> CLEAR;
            case "CLOUDY" -> OVERCAST;
            case "RAINY", "HEAVY_RAIN", "DRIZZLE" -> RAIN;
            case "THUNDERSTORM" -> STORM;
            default -> byName(normalized);
        };
    }

    private static WeatherCondition byName(String normalized) {
        for (WeatherCondition condition : values()) {
            if (condition.name().equals(normalized)) {
                return condition;
            }
        }
        return UNKNOWN;
    }
}
