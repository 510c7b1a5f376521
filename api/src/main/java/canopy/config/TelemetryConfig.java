package canopy.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * canopy.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "canopy.telemetry")
public interface TelemetryConfig {

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
