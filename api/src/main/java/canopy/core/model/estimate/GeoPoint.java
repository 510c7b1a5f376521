package canopy.core.model.estimate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A WGS84 location.
 *
 * @param latitude  degrees north, between -90 and 90
 * @param longitude degrees east, between -180 and 180
 */
public record GeoPoint(double latitude, double longitude) {

    private static final double EARTH_RADIUS_KM = 6371.0088;

    public GeoPoint {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be between -90 and 90, got: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be between -180 and 180, got: " + longitude);
        }
    }

    /**
     * Great-circle distance to another point using the haversine formula.
     *
     * @param other the other point
     * @return distance in kilometres
     */
    public double distanceKm(GeoPoint other) {
        final var dLat = Math.toRadians(other.latitude - latitude);
        final var dLon = Math.toRadians(other.longitude - longitude);
        final var a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(latitude))
                        * Math.cos(Math.toRadians(other.latitude))
                        * Math.sin(dLon / 2)
                        * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    /**
     * Render the latitude rounded half-up to a fixed number of decimals.
     *
     * <p>Trailing zeros are kept so that the rendering is canonical ({@code 20.5} and
     * {@code 20.50001} both become {@code "20.5000"} at precision 4).
     *
     * @param decimals decimal places to keep
     * @return canonical latitude string
     */
    public String roundedLatitude(int decimals) {
        return round(latitude, decimals);
    }

    /**
     * Render the longitude rounded half-up to a fixed number of decimals.
     *
     * @param decimals decimal places to keep
     * @return canonical longitude string
     */
    public String roundedLongitude(int decimals) {
        return round(longitude, decimals);
    }

    private static String round(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }
}
