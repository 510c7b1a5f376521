package canopy.core.config;

/**
 * A latitude/longitude rectangle, shared by provider coverage and priority areas.
 */
public interface BoundsConfig {

    double minLatitude();

    double maxLatitude();

    double minLongitude();

    double maxLongitude();
}
