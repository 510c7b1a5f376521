package canopy.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import canopy.core.port.out.RateLimiter;
import canopy.core.service.fallback.ProviderChain;

/**
 * Reports the configured provider chain.
 *
 * <p>Always UP: the baseline estimator answers even when every provider is down,
 * so provider outages show up in metrics rather than in readiness.
 */
@Readiness
@ApplicationScoped
public class ProviderChainHealthCheck implements HealthCheck {

    private final ProviderChain chain;
    private final RateLimiter rateLimiter;

    @Inject
    public ProviderChainHealthCheck(ProviderChain chain, RateLimiter rateLimiter) {
        this.chain = chain;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public HealthCheckResponse call() {
        final var builder = HealthCheckResponse.builder().name("provider-chain");
        for (final var link : chain.links()) {
            builder.withData("provider." + link.level(), link.name());
        }
        builder.withData("baseline.level", chain.baselineLevel());
        builder.withData("rate-limiting.enabled", rateLimiter.isEnabled());
        return builder.up().build();
    }
}
