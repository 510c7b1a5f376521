package canopy.core.service.selection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.provider.ProviderDescriptor;
import canopy.core.model.provider.ProviderTrait;
import canopy.core.model.provider.SkipCondition;
import canopy.core.model.selection.GrowthRateClass;
import canopy.core.model.selection.ProviderPlan;
import canopy.core.model.selection.RemotenessClass;
import canopy.core.model.selection.SelectionContext;
import canopy.core.model.selection.ValueClass;

/**
 * Reorders the provider chain for a single request.
 *
 * <p>Providers whose coverage excludes the location are removed first, then those
 * whose skip conditions match the request: heavy precipitation, a priority area
 * or a rapid-growth crop. The remaining providers are reordered by these rules,
 * listed by precedence:
 * <ol>
 *   <li>heavy cloud or precipitation: cloud-tolerant providers to the front</li>
 *   <li>sparse reference coverage: the lowest-tier always-available provider to the front</li>
 *   <li>high-value use case: the highest-resolution provider to the front</li>
 *   <li>rapid growth: the most frequently revisiting provider to the front</li>
 * </ol>
 *
 * <p>Every matching rule is applied, lowest precedence first, so the highest
 * matching rule owns the front of the order while lower rules still shape the
 * rest. Each promotion keeps the relative order of the providers it moves and of
 * those it leaves. The reason names the highest-precedence rule that applied.
 *
 * <p>The plan also carries the weather's attempt timeout factor.
 *
 * <p>Pure: no I/O and no state.
 */
@ApplicationScoped
public class ProviderSelectionPolicy {

    static final String STANDARD_REASON = "Standard conditions - default provider order";
    static final String OUTSIDE_COVERAGE = "Location outside provider coverage";

    /**
     * Computes the attempt order.
     *
     * @param defaultOrder providers in default fallback order
     * @param context      request classification
     * @param location     requested location
     * @return the plan
     */
    public ProviderPlan plan(List<ProviderDescriptor> defaultOrder, SelectionContext context, GeoPoint location) {
        final var order = new ArrayList<ProviderDescriptor>(defaultOrder.size());
        final var excluded = new ArrayList<ProviderPlan.Exclusion>();
        for (final var descriptor : defaultOrder) {
            final var skipReason = skipReason(descriptor, context, location);
            if (skipReason.isPresent()) {
                excluded.add(new ProviderPlan.Exclusion(descriptor, skipReason.get()));
            } else {
                order.add(descriptor);
            }
        }

        var reason = STANDARD_REASON;

        if (context.growthRate() == GrowthRateClass.RAPID) {
            final var fastest = order.stream().min(Comparator.comparing(ProviderDescriptor::revisitInterval));
            if (fastest.isPresent()) {
                promote(order, List.of(fastest.get()));
                reason = "Rapid growth crop - prioritizing frequent revisit (%s)".formatted(fastest.get().name());
            }
        }

        if (context.value() == ValueClass.HIGH_VALUE) {
            final var sharpest = order.stream().min(Comparator.comparingDouble(ProviderDescriptor::resolutionMeters));
            if (sharpest.isPresent()) {
                promote(order, List.of(sharpest.get()));
                reason = "High-value use - prioritizing highest resolution (%s)".formatted(sharpest.get().name());
            }
        }

        if (context.remoteness() == RemotenessClass.SPARSE) {
            final var alwaysAvailable = defaultOrder.stream()
                    .filter(order::contains)
                    .filter(d -> d.has(ProviderTrait.ALWAYS_AVAILABLE))
                    .reduce((first, second) -> second);
            if (alwaysAvailable.isPresent()) {
                promote(order, List.of(alwaysAvailable.get()));
                reason = "Remote area - prioritizing always-available coverage (%s)"
                        .formatted(alwaysAvailable.get().name());
            }
        }

        if (context.weather().isHeavyCloudOrPrecipitation()) {
            final var tolerant = order.stream()
                    .filter(d -> d.has(ProviderTrait.CLOUD_TOLERANT))
                    .toList();
            if (!tolerant.isEmpty()) {
                promote(order, tolerant);
                reason = "Cloudy or rainy weather (%s) - prioritizing cloud-tolerant providers (%s)"
                        .formatted(
                                context.weather(),
                                tolerant.stream().map(ProviderDescriptor::name).collect(Collectors.joining(", ")));
            }
        }

        return new ProviderPlan(order, excluded, reason, context.weather().attemptTimeoutFactor());
    }

    private static Optional<String> skipReason(
            ProviderDescriptor descriptor, SelectionContext context, GeoPoint location) {
        if (!descriptor.covers(location)) {
            return Optional.of(OUTSIDE_COVERAGE);
        }
        for (final var condition : SkipCondition.values()) {
            if (descriptor.skipsWhen(condition) && applies(condition, context)) {
                return Optional.of(condition.reason());
            }
        }
        return Optional.empty();
    }

    private static boolean applies(SkipCondition condition, SelectionContext context) {
        return switch (condition) {
            case HEAVY_PRECIPITATION -> context.weather().isHeavyPrecipitation();
            case PRIORITY_AREA -> context.inPriorityArea();
            case RAPID_GROWTH -> context.growthRate() == GrowthRateClass.RAPID;
        };
    }

    private static void promote(List<ProviderDescriptor> order, List<ProviderDescriptor> promoted) {
        order.removeAll(promoted);
        order.addAll(0, promoted);
    }
}
