package canopy.adapter.out.provider;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import canopy.core.config.FallbackConfig;
import canopy.core.config.FallbackConfig.ProviderConfig;
import canopy.core.model.provider.BoundingBox;
import canopy.core.model.provider.ProviderDescriptor;
import canopy.core.model.provider.ProviderTrait;
import canopy.core.model.provider.SkipCondition;
import canopy.core.port.out.ReadingProvider;
import canopy.core.service.fallback.ProviderChain;

/**
 * CDI producer for the provider chain.
 *
 * <p>Builds one descriptor and one HTTP adapter per configured provider. All
 * adapters share a single {@link WebClient}.
 */
@ApplicationScoped
public class ProviderChainProducer {

    private static final Logger LOG = Logger.getLogger(ProviderChainProducer.class);

    private final FallbackConfig config;
    private final Clock clock;
    private final WebClient webClient;

    @Inject
    public ProviderChainProducer(FallbackConfig config, Vertx vertx, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.webClient = WebClient.create(vertx);
    }

    /**
     * Produces the provider chain for CDI injection.
     *
     * @return the chain in default fallback order
     */
    @Produces
    @Singleton
    public ProviderChain providerChain() {
        final var descriptors = new ArrayList<ProviderDescriptor>();
        final var adapters = new ArrayList<ReadingProvider>();
        for (final var provider : config.providers()) {
            final var descriptor = toDescriptor(provider);
            descriptors.add(descriptor);
            adapters.add(new HttpReadingProvider(webClient, descriptor, provider.endpoint(), clock));
        }

        final var chain = new ProviderChain(descriptors, adapters);
        LOG.infov(
                "Provider chain: {0}, baseline at level {1}, race width {2}",
                chain.defaultOrder().stream().map(ProviderDescriptor::name).toList(),
                chain.baselineLevel(),
                config.raceWidth());
        return chain;
    }

    @PreDestroy
    void close() {
        webClient.close();
    }

    static ProviderDescriptor toDescriptor(ProviderConfig provider) {
        final var traits = provider.traits()
                .filter(list -> !list.isEmpty())
                .map(EnumSet::copyOf)
                .orElseGet(() -> EnumSet.noneOf(ProviderTrait.class));
        final var skipWhen = provider.skipWhen()
                .filter(list -> !list.isEmpty())
                .map(EnumSet::copyOf)
                .orElseGet(() -> EnumSet.noneOf(SkipCondition.class));
        final var coverage = provider.coverage()
                .map(box -> new BoundingBox(
                        box.minLatitude(), box.maxLatitude(), box.minLongitude(), box.maxLongitude()));
        return new ProviderDescriptor(
                provider.rank(),
                provider.name(),
                provider.resolutionMeters(),
                provider.revisit(),
                provider.timeout(),
                provider.maxRetries(),
                provider.confidence(),
                traits,
                coverage,
                skipWhen);
    }
}
