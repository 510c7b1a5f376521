package canopy.core.service.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.provider.BoundingBox;
import canopy.core.model.provider.ProviderDescriptor;
import canopy.core.model.provider.ProviderTrait;
import canopy.core.model.provider.SkipCondition;
import canopy.core.model.selection.GrowthRateClass;
import canopy.core.model.selection.RemotenessClass;
import canopy.core.model.selection.SelectionContext;
import canopy.core.model.selection.ValueClass;
import canopy.core.model.selection.WeatherCondition;

@DisplayName("ProviderSelectionPolicy")
class ProviderSelectionPolicyTest {

    private static final GeoPoint FIELD = new GeoPoint(21.25, 81.63);

    private static final ProviderDescriptor SENTINEL =
            descriptor(1, "sentinel2", 10, Duration.ofDays(5), Set.of(ProviderTrait.OPTICAL));
    private static final ProviderDescriptor LANDSAT =
            descriptor(2, "landsat", 30, Duration.ofDays(16), Set.of(ProviderTrait.OPTICAL));
    private static final ProviderDescriptor MODIS = descriptor(
            3,
            "modis",
            250,
            Duration.ofDays(1),
            Set.of(ProviderTrait.CLOUD_TOLERANT, ProviderTrait.ALWAYS_AVAILABLE));

    private static final List<ProviderDescriptor> DEFAULT_ORDER = List.of(SENTINEL, LANDSAT, MODIS);

    private final ProviderSelectionPolicy policy = new ProviderSelectionPolicy();

    private static ProviderDescriptor descriptor(
            int rank, String name, double resolution, Duration revisit, Set<ProviderTrait> traits) {
        return new ProviderDescriptor(
                rank, name, resolution, revisit, Duration.ofSeconds(30), 2, 0.9, traits, Optional.empty());
    }

    private static SelectionContext context(
            WeatherCondition weather, RemotenessClass remoteness, ValueClass value, GrowthRateClass growth) {
        return new SelectionContext(weather, remoteness, value, growth);
    }

    private List<String> order(SelectionContext context) {
        return policy.plan(DEFAULT_ORDER, context, FIELD).orderedNames();
    }

    @Nested
    @DisplayName("Single rules")
    class SingleRuleTests {

        @Test
        @DisplayName("should keep the default order in standard conditions")
        void shouldKeepDefaultOrder() {
            var plan = policy.plan(DEFAULT_ORDER, SelectionContext.neutral(), FIELD);

            assertEquals(List.of("sentinel2", "landsat", "modis"), plan.orderedNames());
            assertEquals(ProviderSelectionPolicy.STANDARD_REASON, plan.reason());
            assertTrue(plan.excluded().isEmpty());
        }

        @Test
        @DisplayName("should promote cloud-tolerant providers in heavy weather")
        void shouldPromoteCloudTolerantInHeavyWeather() {
            var plan = policy.plan(
                    DEFAULT_ORDER,
                    context(WeatherCondition.RAIN, RemotenessClass.WELL_COVERED, ValueClass.STANDARD,
                            GrowthRateClass.NORMAL),
                    FIELD);

            assertEquals(List.of("modis", "sentinel2", "landsat"), plan.orderedNames());
            assertEquals(
                    "Cloudy or rainy weather (RAIN) - prioritizing cloud-tolerant providers (modis)", plan.reason());
        }

        @Test
        @DisplayName("should ignore light weather")
        void shouldIgnoreLightWeather() {
            var names = order(context(
                    WeatherCondition.PARTLY_CLOUDY,
                    RemotenessClass.WELL_COVERED,
                    ValueClass.STANDARD,
                    GrowthRateClass.NORMAL));

            assertEquals(List.of("sentinel2", "landsat", "modis"), names);
        }

        @Test
        @DisplayName("should promote the always-available provider for sparse coverage")
        void shouldPromoteAlwaysAvailableForSparseCoverage() {
            var names = order(context(
                    WeatherCondition.CLEAR, RemotenessClass.SPARSE, ValueClass.STANDARD, GrowthRateClass.NORMAL));

            assertEquals(List.of("modis", "sentinel2", "landsat"), names);
        }

        @Test
        @DisplayName("should promote the highest resolution provider for high-value use")
        void shouldPromoteHighestResolutionForHighValue() {
            var reordered = List.of(MODIS, LANDSAT, SENTINEL);

            var plan = policy.plan(
                    reordered,
                    context(WeatherCondition.CLEAR, RemotenessClass.WELL_COVERED, ValueClass.HIGH_VALUE,
                            GrowthRateClass.NORMAL),
                    FIELD);

            assertEquals(List.of("sentinel2", "modis", "landsat"), plan.orderedNames());
            assertEquals("High-value use - prioritizing highest resolution (sentinel2)", plan.reason());
        }

        @Test
        @DisplayName("should promote the most frequently revisiting provider for rapid growth")
        void shouldPromoteFastestRevisitForRapidGrowth() {
            var plan = policy.plan(
                    DEFAULT_ORDER,
                    context(WeatherCondition.CLEAR, RemotenessClass.WELL_COVERED, ValueClass.STANDARD,
                            GrowthRateClass.RAPID),
                    FIELD);

            assertEquals(List.of("modis", "sentinel2", "landsat"), plan.orderedNames());
            assertEquals("Rapid growth crop - prioritizing frequent revisit (modis)", plan.reason());
        }
    }

    @Nested
    @DisplayName("Combined rules")
    class CombinedRuleTests {

        @Test
        @DisplayName("should let heavy weather win the front over high-value use")
        void shouldLetWeatherWinOverHighValue() {
            var plan = policy.plan(
                    DEFAULT_ORDER,
                    context(WeatherCondition.STORM, RemotenessClass.WELL_COVERED, ValueClass.HIGH_VALUE,
                            GrowthRateClass.NORMAL),
                    FIELD);

            assertEquals(List.of("modis", "sentinel2", "landsat"), plan.orderedNames());
            assertTrue(plan.reason().startsWith("Cloudy or rainy weather"));
        }

        @Test
        @DisplayName("should keep lower rules shaping the rest of the order")
        void shouldKeepLowerRulesShapingRemainder() {
            var landsatFast = descriptor(2, "landsat", 30, Duration.ofHours(12), Set.of(ProviderTrait.OPTICAL));
            var chain = List.of(SENTINEL, landsatFast, MODIS);

            // rapid growth puts landsat first, high value then puts sentinel2 ahead of it
            var plan = policy.plan(
                    chain,
                    context(WeatherCondition.CLEAR, RemotenessClass.WELL_COVERED, ValueClass.HIGH_VALUE,
                            GrowthRateClass.RAPID),
                    FIELD);

            assertEquals(List.of("sentinel2", "landsat", "modis"), plan.orderedNames());
            assertTrue(plan.reason().startsWith("High-value use"));
        }

        @Test
        @DisplayName("should keep every provider as a candidate")
        void shouldKeepEveryProvider() {
            var names = order(context(
                    WeatherCondition.OVERCAST, RemotenessClass.SPARSE, ValueClass.HIGH_VALUE, GrowthRateClass.RAPID));

            assertEquals(3, names.size());
            assertTrue(names.containsAll(List.of("sentinel2", "landsat", "modis")));
        }

        @Test
        @DisplayName("should promote the lowest-tier always-available provider when several qualify")
        void shouldPromoteLowestTierAlwaysAvailable() {
            var backup = descriptor(
                    4, "backup", 500, Duration.ofDays(2), Set.of(ProviderTrait.ALWAYS_AVAILABLE));

            var plan = policy.plan(
                    List.of(SENTINEL, LANDSAT, MODIS, backup),
                    context(WeatherCondition.CLEAR, RemotenessClass.SPARSE, ValueClass.STANDARD,
                            GrowthRateClass.NORMAL),
                    FIELD);

            assertEquals(List.of("backup", "sentinel2", "landsat", "modis"), plan.orderedNames());
        }
    }

    @Nested
    @DisplayName("Coverage")
    class CoverageTests {

        @Test
        @DisplayName("should exclude providers whose coverage misses the location")
        void shouldExcludeUncoveredProviders() {
            var regional = new ProviderDescriptor(
                    2,
                    "regional",
                    5,
                    Duration.ofDays(3),
                    Duration.ofSeconds(10),
                    1,
                    0.9,
                    Set.of(),
                    Optional.of(new BoundingBox(10.0, 11.0, 70.0, 71.0)));

            var plan = policy.plan(List.of(SENTINEL, regional, MODIS), SelectionContext.neutral(), FIELD);

            assertEquals(List.of("sentinel2", "modis"), plan.orderedNames());
            assertEquals(List.of("regional"), plan.excludedNames());
            assertEquals(ProviderSelectionPolicy.OUTSIDE_COVERAGE, plan.excluded().get(0).reason());
        }

        @Test
        @DisplayName("should not promote an excluded provider")
        void shouldNotPromoteExcludedProvider() {
            var regionalModis = new ProviderDescriptor(
                    3,
                    "modis",
                    250,
                    Duration.ofDays(1),
                    Duration.ofSeconds(20),
                    2,
                    0.8,
                    Set.of(ProviderTrait.CLOUD_TOLERANT, ProviderTrait.ALWAYS_AVAILABLE),
                    Optional.of(new BoundingBox(0.0, 1.0, 0.0, 1.0)));

            var plan = policy.plan(
                    List.of(SENTINEL, LANDSAT, regionalModis),
                    context(WeatherCondition.RAIN, RemotenessClass.SPARSE, ValueClass.STANDARD,
                            GrowthRateClass.NORMAL),
                    FIELD);

            assertEquals(List.of("sentinel2", "landsat"), plan.orderedNames());
            assertEquals(ProviderSelectionPolicy.STANDARD_REASON, plan.reason());
        }
    }

    @Nested
    @DisplayName("Skip conditions")
    class SkipConditionTests {

        private ProviderDescriptor skipping(ProviderDescriptor base, SkipCondition condition) {
            return new ProviderDescriptor(
                    base.priorityRank(),
                    base.name(),
                    base.resolutionMeters(),
                    base.revisitInterval(),
                    base.perAttemptTimeout(),
                    base.maxRetries(),
                    base.confidence(),
                    base.traits(),
                    base.coverage(),
                    Set.of(condition));
        }

        private final List<ProviderDescriptor> chain = List.of(
                skipping(SENTINEL, SkipCondition.HEAVY_PRECIPITATION),
                skipping(LANDSAT, SkipCondition.RAPID_GROWTH),
                skipping(MODIS, SkipCondition.PRIORITY_AREA));

        @Test
        @DisplayName("should attempt every provider when no condition matches")
        void shouldKeepAllWithoutMatch() {
            var plan = policy.plan(chain, context(WeatherCondition.PARTLY_CLOUDY, RemotenessClass.WELL_COVERED,
                    ValueClass.STANDARD, GrowthRateClass.NORMAL), FIELD);

            assertEquals(List.of("sentinel2", "landsat", "modis"), plan.orderedNames());
            assertTrue(plan.excluded().isEmpty());
        }

        @Test
        @DisplayName("should skip the optical provider in a storm")
        void shouldSkipInStorm() {
            var plan = policy.plan(chain, context(WeatherCondition.STORM, RemotenessClass.WELL_COVERED,
                    ValueClass.STANDARD, GrowthRateClass.NORMAL), FIELD);

            assertEquals(List.of("modis", "landsat"), plan.orderedNames());
            assertEquals(List.of("sentinel2"), plan.excludedNames());
            assertEquals(SkipCondition.HEAVY_PRECIPITATION.reason(), plan.excluded().get(0).reason());
        }

        @Test
        @DisplayName("should not skip on overcast skies alone")
        void shouldNotSkipWhenOvercast() {
            var plan = policy.plan(chain, context(WeatherCondition.OVERCAST, RemotenessClass.WELL_COVERED,
                    ValueClass.STANDARD, GrowthRateClass.NORMAL), FIELD);

            assertTrue(plan.excluded().isEmpty());
        }

        @Test
        @DisplayName("should skip the slow-revisit provider for a rapid-growth crop")
        void shouldSkipForRapidGrowth() {
            var plan = policy.plan(chain, context(WeatherCondition.UNKNOWN, RemotenessClass.WELL_COVERED,
                    ValueClass.STANDARD, GrowthRateClass.RAPID), FIELD);

            assertEquals(List.of("modis", "sentinel2"), plan.orderedNames());
            assertEquals(List.of("landsat"), plan.excludedNames());
        }

        @Test
        @DisplayName("should skip the coarse provider in a priority area")
        void shouldSkipInPriorityArea() {
            var inArea = new SelectionContext(WeatherCondition.UNKNOWN, RemotenessClass.WELL_COVERED,
                    ValueClass.HIGH_VALUE, GrowthRateClass.NORMAL, true);

            var plan = policy.plan(chain, inArea, FIELD);

            assertEquals(List.of("sentinel2", "landsat"), plan.orderedNames());
            assertEquals(List.of("modis"), plan.excludedNames());
            assertEquals(SkipCondition.PRIORITY_AREA.reason(), plan.excluded().get(0).reason());
        }

        @Test
        @DisplayName("should ignore skip conditions a provider does not declare")
        void shouldIgnoreUndeclaredConditions() {
            var plan = policy.plan(DEFAULT_ORDER, new SelectionContext(WeatherCondition.STORM,
                    RemotenessClass.WELL_COVERED, ValueClass.STANDARD, GrowthRateClass.RAPID, true), FIELD);

            assertTrue(plan.excluded().isEmpty());
        }
    }

    @Nested
    @DisplayName("Timeout factor")
    class TimeoutFactorTests {

        @Test
        @DisplayName("should scale timeouts by the weather")
        void shouldScaleByWeather() {
            assertEquals(1.5, factorFor(WeatherCondition.OVERCAST));
            assertEquals(1.5, factorFor(WeatherCondition.RAIN));
            assertEquals(0.8, factorFor(WeatherCondition.CLEAR));
            assertEquals(1.0, factorFor(WeatherCondition.PARTLY_CLOUDY));
            assertEquals(1.0, factorFor(WeatherCondition.UNKNOWN));
        }

        private double factorFor(WeatherCondition weather) {
            return policy.plan(DEFAULT_ORDER, context(weather, RemotenessClass.WELL_COVERED, ValueClass.STANDARD,
                    GrowthRateClass.NORMAL), FIELD).timeoutFactor();
        }
    }
}
