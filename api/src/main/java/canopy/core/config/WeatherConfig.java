package canopy.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the weather condition upstream.
 *
 * <p>Configuration prefix: {@code canopy.weather}
 *
 * <p>Without an endpoint every lookup answers {@code UNKNOWN}, which leaves the
 * weather rule of the selection policy inactive.
 */
@ConfigMapping(prefix = "canopy.weather")
public interface WeatherConfig {

    Optional<String> endpoint();

    /**
     * @return bound on a single lookup (default: 3 seconds)
     */
    @WithDefault("PT3S")
    Duration timeout();
}
