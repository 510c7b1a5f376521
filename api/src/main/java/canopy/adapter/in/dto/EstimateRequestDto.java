package canopy.adapter.in.dto;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.selection.WeatherCondition;

/**
 * DTO for estimate requests.
 *
 * @param latitude  field latitude in degrees (required)
 * @param longitude field longitude in degrees (required)
 * @param date      ISO-8601 analysis date (optional, defaults to today)
 * @param crop      crop category (optional, e.g. "rice")
 * @param weather   weather already known to the caller (optional, e.g. "cloudy")
 * @param params    extra parameters forwarded to providers (optional)
 */
public record EstimateRequestDto(
        Double latitude, Double longitude, String date, String crop, String weather, Map<String, String> params) {

    /**
     * Convert to the domain request.
     *
     * @param today date used when none is given
     * @return the domain request
     * @throws IllegalArgumentException if a field is missing or malformed
     */
    public EstimateRequest toModel(LocalDate today) {
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("latitude and longitude are required");
        }
        final var location = new GeoPoint(latitude, longitude);
        final var weatherHint = Optional.ofNullable(weather)
                .filter(w -> !w.isBlank())
                .map(WeatherCondition::parse);
        return new EstimateRequest(location, parseDate(today), crop, weatherHint, params);
    }

    private LocalDate parseDate(LocalDate today) {
        if (date == null || date.isBlank()) {
            return today;
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("date must be an ISO-8601 date (yyyy-MM-dd), got: " + date);
        }
    }
}
