package canopy.core.service.fallback;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import canopy.core.model.provider.ProviderDescriptor;
import canopy.core.port.out.ReadingProvider;

/**
 * The configured providers in their default fallback order, each paired with its adapter.
 *
 * <p>Default order is ascending {@code priorityRank}; equal ranks keep declaration
 * order. A provider's fallback level is its 1-based position in this order and
 * the baseline sits one level below the last provider.
 */
public final class ProviderChain {

    private final List<Link> links;
    private final Map<String, Link> byName;

    /**
     * A provider with its adapter and fallback level.
     *
     * @param descriptor the provider's static description
     * @param provider   the adapter that fetches readings
     * @param level      1-based position in the default order
     */
    public record Link(ProviderDescriptor descriptor, ReadingProvider provider, int level) {

        public Link {
            Objects.requireNonNull(descriptor, "descriptor must not be null");
            Objects.requireNonNull(provider, "provider must not be null");
        }

        public String name() {
            return descriptor.name();
        }
    }

    /**
     * Builds the chain.
     *
     * @param descriptors provider descriptions in declaration order
     * @param providers   adapters, matched to descriptors by name
     * @throws IllegalArgumentException if names are duplicated or a descriptor has no adapter
     */
    public ProviderChain(List<ProviderDescriptor> descriptors, List<ReadingProvider> providers) {
        final var adapters = new LinkedHashMap<String, ReadingProvider>();
        for (final var provider : providers) {
            if (adapters.putIfAbsent(provider.name(), provider) != null) {
                throw new IllegalArgumentException("Duplicate provider adapter: " + provider.name());
            }
        }

        // List.sort is stable, so equal ranks keep declaration order
        final var sorted = new ArrayList<>(descriptors);
        sorted.sort(Comparator.comparingInt(ProviderDescriptor::priorityRank));

        final var built = new ArrayList<Link>(sorted.size());
        final var index = new LinkedHashMap<String, Link>();
        for (final var descriptor : sorted) {
            final var adapter = adapters.get(descriptor.name());
            if (adapter == null) {
                throw new IllegalArgumentException("No adapter for provider: " + descriptor.name());
            }
            final var link = new Link(descriptor, adapter, built.size() + 1);
            if (index.putIfAbsent(descriptor.name(), link) != null) {
                throw new IllegalArgumentException("Duplicate provider: " + descriptor.name());
            }
            built.add(link);
        }
        this.links = List.copyOf(built);
        this.byName = Map.copyOf(index);
    }

    public List<Link> links() {
        return links;
    }

    /**
     * @return descriptors in default fallback order
     */
    public List<ProviderDescriptor> defaultOrder() {
        return links.stream().map(Link::descriptor).toList();
    }

    public Optional<Link> link(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return links.size();
    }

    /**
     * @return the fallback level reported for baseline answers
     */
    public int baselineLevel() {
        return links.size() + 1;
    }
}
