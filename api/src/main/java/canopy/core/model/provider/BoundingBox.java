package canopy.core.model.provider;

import canopy.core.model.estimate.GeoPoint;

/**
 * Axis-aligned latitude/longitude box, bounds inclusive.
 */
public record BoundingBox(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {

    public BoundingBox {
        if (minLatitude > maxLatitude) {
            throw new IllegalArgumentException("minLatitude must not exceed maxLatitude");
        }
        if (minLongitude > maxLongitude) {
            throw new IllegalArgumentException("minLongitude must not exceed maxLongitude");
        }
    }

    public boolean contains(GeoPoint point) {
        return point.latitude() >= minLatitude
                && point.latitude() <= maxLatitude
                && point.longitude() >= minLongitude
                && point.longitude() <= maxLongitude;
    }
}
