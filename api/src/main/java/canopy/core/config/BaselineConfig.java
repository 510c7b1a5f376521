package canopy.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Regional averages returned when every provider has failed.
 *
 * <p>Configuration prefix: {@code canopy.baseline}
 */
@ConfigMapping(prefix = "canopy.baseline")
public interface BaselineConfig {

    /**
     * @return nitrogen in kg/ha (default: 200)
     */
    @WithDefault("200")
    double nitrogen();

    /**
     * @return phosphorus in kg/ha (default: 25)
     */
    @WithDefault("25")
    double phosphorus();

    /**
     * @return potassium in kg/ha (default: 150)
     */
    @WithDefault("150")
    double potassium();

    /**
     * @return soil pH (default: 6.5)
     */
    @WithDefault("6.5")
    double ph();

    /**
     * @return confidence attached to baseline estimates (default: 0.70)
     */
    @WithDefault("0.70")
    double confidence();
}
