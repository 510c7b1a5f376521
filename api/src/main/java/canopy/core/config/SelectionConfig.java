package canopy.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the request classification that drives provider reordering.
 *
 * <p>Configuration prefix: {@code canopy.selection}
 */
@ConfigMapping(prefix = "canopy.selection")
public interface SelectionConfig {

    /**
     * Crops whose estimates justify the highest-resolution provider.
     *
     * @return upper-case crop names
     */
    @WithDefault("RICE,WHEAT,CORN,VEGETABLES,FRUITS")
    Set<String> highValueCrops();

    /**
     * Crops that change fast enough to prefer frequent revisits over resolution.
     *
     * @return upper-case crop names
     */
    @WithDefault("LETTUCE,SPINACH,RADISH,CUCUMBER,TOMATO,PEPPER,HERBS,MICROGREENS")
    Set<String> rapidGrowthCrops();

    /**
     * Regions treated as high value regardless of crop.
     */
    List<BoundsConfig> priorityAreas();

    /**
     * Known settlements used to judge how well a location is covered.
     */
    List<SiteConfig> referenceSites();

    /**
     * A location with no reference site within this distance is considered sparsely covered.
     *
     * @return distance in kilometres (default: 25)
     */
    @WithDefault("25")
    double remoteDistanceKm();

    /**
     * @return how long a looked-up weather condition is reused (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration weatherCacheTtl();

    /**
     * @return bound on memoized weather conditions (default: 1000)
     */
    @WithDefault("1000")
    long weatherCacheMaxEntries();

    /**
     * A named reference point.
     */
    interface SiteConfig {

        String name();

        double latitude();

        double longitude();
    }
}
