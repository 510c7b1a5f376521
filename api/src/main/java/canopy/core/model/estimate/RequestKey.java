package canopy.core.model.estimate;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cache identity of an estimate request.
 *
 * <p>Coordinates are rounded to a fixed precision so that requests a few metres apart
 * reuse the same upstream answer. Parameters are held in a sorted map, which makes the
 * encoding independent of the order in which the caller supplied them. The crop is
 * folded into the parameters under {@code crop}.
 *
 * <p>Key format: {@code {lat}|{lon}|{date}|{k1}={v1}&{k2}={v2}}
 *
 * @param latitude  rounded latitude
 * @param longitude rounded longitude
 * @param date      analysis date
 * @param params    the request parameters plus the crop, sorted by name
 */
public record RequestKey(String latitude, String longitude, LocalDate date, SortedMap<String, String> params) {

    public RequestKey {
        Objects.requireNonNull(latitude, "latitude must not be null");
        Objects.requireNonNull(longitude, "longitude must not be null");
        Objects.requireNonNull(date, "date must not be null");
        params = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNullElse(params, new TreeMap<>())));
    }

    /**
     * Builds the key for a request.
     *
     * @param request   the request
     * @param precision decimal places kept for latitude and longitude
     * @return the key
     */
    public static RequestKey of(EstimateRequest request, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be non-negative, got: " + precision);
        }
        final var normalized = new TreeMap<>(request.params());
        normalized.put(EstimateRequest.CROP_PARAM, request.crop());

        return new RequestKey(
                request.location().roundedLatitude(precision),
                request.location().roundedLongitude(precision),
                request.date(),
                normalized);
    }

    /**
     * Converts this key to its string encoding.
     *
     * @return the encoded key
     */
    public String toCacheKey() {
        final var encodedParams = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return latitude + "|" + longitude + "|" + date + "|" + encodedParams;
    }

    @Override
    public String toString() {
        return toCacheKey();
    }
}
