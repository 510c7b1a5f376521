package canopy.core.model.selection;

import java.util.List;
import java.util.Objects;

import canopy.core.model.provider.ProviderDescriptor;

/**
 * Provider order chosen for a single request.
 *
 * @param ordered       providers to attempt, in order
 * @param excluded      providers ruled out by a hard constraint, in default order
 * @param reason        human-readable reason for the order
 * @param timeoutFactor scale applied to every provider's attempt timeout for this request
 */
public record ProviderPlan(
        List<ProviderDescriptor> ordered, List<Exclusion> excluded, String reason, double timeoutFactor) {

    public ProviderPlan {
        ordered = List.copyOf(ordered);
        excluded = List.copyOf(excluded);
        Objects.requireNonNull(reason, "reason must not be null");
        if (timeoutFactor <= 0.0) {
            throw new IllegalArgumentException("timeoutFactor must be positive");
        }
    }

    public List<String> orderedNames() {
        return ordered.stream().map(ProviderDescriptor::name).toList();
    }

    public List<String> excludedNames() {
        return excluded.stream().map(exclusion -> exclusion.provider().name()).toList();
    }

    /**
     * A provider left out of the request, with the constraint that ruled it out.
     *
     * @param provider the excluded provider
     * @param reason   detail recorded on its skipped attempt
     */
    public record Exclusion(ProviderDescriptor provider, String reason) {

        public Exclusion {
            Objects.requireNonNull(provider, "provider must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
