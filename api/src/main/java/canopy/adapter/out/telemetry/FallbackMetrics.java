package canopy.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import canopy.config.TelemetryConfig;
import canopy.core.model.estimate.AttemptOutcome;
import canopy.core.port.out.Metrics;

/**
 * Records engine metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code canopy.requests.total} - Handled requests by outcome and answer source</li>
 *   <li>{@code canopy.provider.attempts} - Physical provider attempts by provider and outcome</li>
 *   <li>{@code canopy.provider.latency} - Provider attempt latency</li>
 *   <li>{@code canopy.cache.lookups} - Result cache lookups by hit/miss</li>
 *   <li>{@code canopy.ratelimit.checks} - Admission checks by decision</li>
 *   <li>{@code canopy.cache.size} - Result cache size gauge</li>
 * </ul>
 */
@ApplicationScoped
public class FallbackMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public FallbackMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Request Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRequest(String outcome, String source, long latencyMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("canopy.requests.total")
                .description("Total number of estimate requests handled")
                .tag("outcome", outcome)
                .tag("source", source)
                .register(registry)
                .increment();

        Timer.builder("canopy.requests.latency")
                .description("Time to answer an estimate request")
                .tag("source", source)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    // -------------------------------------------------------------------------
    // Provider Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordAttempt(String provider, AttemptOutcome outcome, long latencyMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("canopy.provider.attempts")
                .description("Physical provider attempts")
                .tag("provider", provider)
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();

        if (outcome == AttemptOutcome.SKIPPED) {
            return;
        }

        Timer.builder("canopy.provider.latency")
                .description("Time spent in a provider attempt")
                .tag("provider", provider)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    // -------------------------------------------------------------------------
    // Cache and Admission Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordCacheLookup(boolean hit) {
        if (!enabled) {
            return;
        }

        Counter.builder("canopy.cache.lookups")
                .description("Result cache lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAdmission(boolean allowed) {
        if (!enabled) {
            return;
        }

        Counter.builder("canopy.ratelimit.checks")
                .description("Rate limit admission checks")
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .increment();
    }

    @Override
    public void registerCacheSize(Supplier<Number> size) {
        if (!enabled) {
            return;
        }

        Gauge.builder("canopy.cache.size", size)
                .description("Entries resident in the result cache")
                .register(registry);
    }
}
