package canopy.core.model.estimate;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import canopy.core.model.selection.WeatherCondition;

/**
 * A request for a nutrient estimate at a location and date.
 *
 * @param location    the field location
 * @param date        the analysis date
 * @param crop        crop category, upper-cased (e.g. {@code RICE}); {@code GENERIC} when unknown
 * @param weatherHint weather already known to the caller, skips the weather lookup when present
 * @param params      additional domain parameters that change the upstream answer; names
 *                    are trimmed and lower-cased, values trimmed
 */
public record EstimateRequest(
        GeoPoint location,
        LocalDate date,
        String crop,
        Optional<WeatherCondition> weatherHint,
        Map<String, String> params) {

    public static final String GENERIC_CROP = "GENERIC";

    static final String CROP_PARAM = "crop";

    public EstimateRequest {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(date, "date must not be null");
        crop = crop == null || crop.isBlank() ? GENERIC_CROP : crop.trim().toUpperCase(Locale.ROOT);
        weatherHint = Objects.requireNonNullElse(weatherHint, Optional.empty());
        params = params == null || params.isEmpty() ? Map.of() : normalize(params);
    }

    /**
     * Creates a request without weather hint or extra parameters.
     *
     * @param location the field location
     * @param date     the analysis date
     * @param crop     crop category
     * @return the request
     */
    public static EstimateRequest of(GeoPoint location, LocalDate date, String crop) {
        return new EstimateRequest(location, date, crop, Optional.empty(), Map.of());
    }

    private static Map<String, String> normalize(Map<String, String> params) {
        final var normalized = new TreeMap<String, String>();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Parameter names must not be blank");
            }
            final var name = entry.getKey().trim().toLowerCase(Locale.ROOT);
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Parameter '" + name + "' must have a value");
            }
            if (CROP_PARAM.equals(name)) {
                throw new IllegalArgumentException("Parameter 'crop' is reserved, use the crop field");
            }
            if (normalized.put(name, entry.getValue().trim()) != null) {
                throw new IllegalArgumentException("Parameter '" + name + "' is given more than once");
            }
        }
        return Collections.unmodifiableMap(normalized);
    }
}
