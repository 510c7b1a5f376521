package canopy.core.model.provider;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import canopy.core.model.estimate.GeoPoint;

/**
 * Static description of an upstream provider, defined at startup.
 *
 * <p>Descriptors are ordered by {@code priorityRank} (lower first) to form the default
 * fallback sequence; equal ranks keep declaration order.
 *
 * @param priorityRank      rank in the default chain, lower is preferred
 * @param name              unique provider name
 * @param resolutionMeters  nominal ground resolution in metres
 * @param revisitInterval   nominal time between observations of the same spot
 * @param perAttemptTimeout bound on a single fetch attempt
 * @param maxRetries        retries after the first attempt before moving on
 * @param confidence        nominal confidence of the source (0..1)
 * @param traits            capabilities used by the selection policy
 * @param coverage          region the provider serves; empty means everywhere
 * @param skipWhen          conditions under which the provider is left out of a request
 */
public record ProviderDescriptor(
        int priorityRank,
        String name,
        double resolutionMeters,
        Duration revisitInterval,
        Duration perAttemptTimeout,
        int maxRetries,
        double confidence,
        Set<ProviderTrait> traits,
        Optional<BoundingBox> coverage,
        Set<SkipCondition> skipWhen) {

    public ProviderDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(revisitInterval, "revisitInterval must not be null");
        Objects.requireNonNull(perAttemptTimeout, "perAttemptTimeout must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (resolutionMeters <= 0) {
            throw new IllegalArgumentException("resolutionMeters must be positive");
        }
        if (perAttemptTimeout.isNegative() || perAttemptTimeout.isZero()) {
            throw new IllegalArgumentException("perAttemptTimeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0 and 1");
        }
        traits = traits == null || traits.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(traits));
        coverage = Objects.requireNonNullElse(coverage, Optional.empty());
        skipWhen = skipWhen == null || skipWhen.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(skipWhen));
    }

    public ProviderDescriptor(
            int priorityRank,
            String name,
            double resolutionMeters,
            Duration revisitInterval,
            Duration perAttemptTimeout,
            int maxRetries,
            double confidence,
            Set<ProviderTrait> traits,
            Optional<BoundingBox> coverage) {
        this(priorityRank, name, resolutionMeters, revisitInterval, perAttemptTimeout, maxRetries, confidence,
                traits, coverage, Set.of());
    }

    public boolean has(ProviderTrait trait) {
        return traits.contains(trait);
    }

    public boolean skipsWhen(SkipCondition condition) {
        return skipWhen.contains(condition);
    }

    /**
     * Whether the provider can serve the given location.
     *
     * @param location the requested location
     * @return false when a coverage region is declared and does not contain the location
     */
    public boolean covers(GeoPoint location) {
        return coverage.map(box -> box.contains(location)).orElse(true);
    }

    /**
     * Resolution label used on estimates, e.g. {@code 10m}.
     *
     * @return the label
     */
    public String resolutionLabel() {
        return resolutionMeters == Math.rint(resolutionMeters)
                ? (long) resolutionMeters + "m"
                : resolutionMeters + "m";
    }
}
