package canopy.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import canopy.core.model.provider.ProviderTrait;
import canopy.core.model.provider.SkipCondition;

/**
 * Configuration mapping for the provider chain and the fallback walk.
 *
 * <p>Configuration prefix: {@code canopy.fallback}
 *
 * <p>Providers are declared as an indexed list. Rank orders the default chain;
 * providers with equal rank keep their declaration order.
 *
 * <pre>
 * canopy.fallback.providers[0].name=sentinel2
 * canopy.fallback.providers[0].rank=1
 * canopy.fallback.providers[0].resolution-meters=10
 * canopy.fallback.providers[0].revisit=P5D
 * canopy.fallback.providers[0].timeout=PT30S
 * canopy.fallback.providers[0].traits=OPTICAL
 * canopy.fallback.providers[0].skip-when=HEAVY_PRECIPITATION
 * canopy.fallback.providers[0].endpoint=http://localhost:8081/sentinel2
 * </pre>
 */
@ConfigMapping(prefix = "canopy.fallback")
public interface FallbackConfig {

    /**
     * Number of providers kept in flight at once while walking the chain.
     *
     * <p>1 walks the chain strictly one provider at a time.
     *
     * @return race width (default: 1)
     */
    @WithDefault("1")
    int raceWidth();

    /**
     * Retry backoff between attempts against the same provider.
     */
    BackoffConfig backoff();

    /**
     * The configured providers, excluding the baseline.
     */
    List<ProviderConfig> providers();

    /**
     * Exponential retry backoff.
     */
    interface BackoffConfig {

        /**
         * @return delay before the first retry (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration initial();

        /**
         * @return ceiling for the doubled delay (default: 4 seconds)
         */
        @WithDefault("PT4S")
        Duration max();
    }

    /**
     * One upstream provider.
     */
    interface ProviderConfig {

        String name();

        /**
         * @return priority rank, lower is tried first
         */
        int rank();

        int resolutionMeters();

        /**
         * @return nominal interval between fresh acquisitions over the same spot
         */
        Duration revisit();

        /**
         * @return bound on a single attempt (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration timeout();

        /**
         * @return retries after the first failed attempt (default: 2)
         */
        @WithDefault("2")
        int maxRetries();

        /**
         * @return confidence attached to estimates from this provider (default: 0.8)
         */
        @WithDefault("0.8")
        double confidence();

        Optional<List<ProviderTrait>> traits();

        /**
         * @return request conditions under which this provider is skipped
         */
        Optional<List<SkipCondition>> skipWhen();

        /**
         * @return base URL the HTTP adapter queries
         */
        String endpoint();

        /**
         * Region the provider serves. Locations outside it skip the provider.
         */
        Optional<BoundsConfig> coverage();
    }
}
