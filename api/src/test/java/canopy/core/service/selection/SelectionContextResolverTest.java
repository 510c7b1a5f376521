package canopy.core.service.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import canopy.core.cache.CaffeineLocalCache;
import canopy.core.config.BoundsConfig;
import canopy.core.config.SelectionConfig;
import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.selection.GrowthRateClass;
import canopy.core.model.selection.RemotenessClass;
import canopy.core.model.selection.ValueClass;
import canopy.core.model.selection.WeatherCondition;
import canopy.core.port.out.WeatherLookup;

@DisplayName("SelectionContextResolver")
class SelectionContextResolverTest {

    private static final Duration AWAIT = Duration.ofSeconds(5);
    private static final LocalDate DATE = LocalDate.of(2024, 6, 1);
    private static final GeoPoint RAIPUR = new GeoPoint(21.2514, 81.6296);
    private static final GeoPoint KANKER_FIELD = new GeoPoint(20.30, 81.30);
    private static final GeoPoint REMOTE = new GeoPoint(19.0, 80.0);

    private SelectionConfig config;
    private AtomicInteger lookups;
    private WeatherCondition reported;

    @BeforeEach
    void setUp() {
        config = mock(SelectionConfig.class);
        when(config.highValueCrops()).thenReturn(Set.of("rice", "WHEAT"));
        when(config.rapidGrowthCrops()).thenReturn(Set.of("LETTUCE", "spinach"));

        var kanker = mock(BoundsConfig.class);
        when(kanker.minLatitude()).thenReturn(20.1);
        when(kanker.maxLatitude()).thenReturn(20.6);
        when(kanker.minLongitude()).thenReturn(81.1);
        when(kanker.maxLongitude()).thenReturn(81.5);
        when(config.priorityAreas()).thenReturn(List.of(kanker));

        var raipur = mock(SelectionConfig.SiteConfig.class);
        when(raipur.name()).thenReturn("raipur");
        when(raipur.latitude()).thenReturn(21.2514);
        when(raipur.longitude()).thenReturn(81.6296);
        when(config.referenceSites()).thenReturn(List.of(raipur));
        when(config.remoteDistanceKm()).thenReturn(25.0);

        lookups = new AtomicInteger();
        reported = WeatherCondition.CLEAR;
    }

    private SelectionContextResolver resolver(WeatherLookup lookup, Duration timeout) {
        var weatherCache = new CaffeineLocalCache<String, WeatherCondition>(Duration.ofHours(1), 100, () -> 0L);
        return new SelectionContextResolver(config, timeout, lookup, weatherCache);
    }

    private SelectionContextResolver resolver() {
        return resolver(
                (location, date) -> {
                    lookups.incrementAndGet();
                    return Uni.createFrom().item(reported);
                },
                Duration.ofSeconds(1));
    }

    private static EstimateRequest request(GeoPoint location, String crop) {
        return EstimateRequest.of(location, DATE, crop);
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("should classify locations near a reference site as well covered")
        void shouldClassifyNearbyAsWellCovered() {
            var resolver = resolver();

            assertEquals(RemotenessClass.WELL_COVERED, resolver.classifyRemoteness(new GeoPoint(21.3, 81.7)));
            assertEquals(RemotenessClass.SPARSE, resolver.classifyRemoteness(REMOTE));
        }

        @Test
        @DisplayName("should treat every location as well covered without reference sites")
        void shouldTreatAllAsWellCoveredWithoutSites() {
            when(config.referenceSites()).thenReturn(List.of());

            assertEquals(RemotenessClass.WELL_COVERED, resolver().classifyRemoteness(REMOTE));
        }

        @Test
        @DisplayName("should classify high-value crops and priority areas as high value")
        void shouldClassifyHighValue() {
            var resolver = resolver();

            assertEquals(ValueClass.HIGH_VALUE, resolver.classifyValue(request(RAIPUR, "Rice")));
            assertEquals(ValueClass.HIGH_VALUE, resolver.classifyValue(request(KANKER_FIELD, "millet")));
            assertEquals(ValueClass.STANDARD, resolver.classifyValue(request(RAIPUR, "millet")));
        }

        @Test
        @DisplayName("should classify rapid growth crops regardless of case")
        void shouldClassifyRapidGrowth() {
            var resolver = resolver();

            assertEquals(GrowthRateClass.RAPID, resolver.classifyGrowth(request(RAIPUR, "Spinach")));
            assertEquals(GrowthRateClass.NORMAL, resolver.classifyGrowth(request(RAIPUR, "rice")));
        }
    }

    @Nested
    @DisplayName("Weather")
    class WeatherTests {

        @Test
        @DisplayName("should use the weather hint without a lookup")
        void shouldUseWeatherHint() {
            var request = new EstimateRequest(RAIPUR, DATE, "rice", Optional.of(WeatherCondition.STORM), Map.of());

            var context = resolver().resolve(request).await().atMost(AWAIT);

            assertEquals(WeatherCondition.STORM, context.weather());
            assertEquals(0, lookups.get());
        }

        @Test
        @DisplayName("should reuse a looked-up condition for the same rounded location and date")
        void shouldReuseLookedUpCondition() {
            reported = WeatherCondition.OVERCAST;
            var resolver = resolver();

            var first = resolver.resolve(request(RAIPUR, "rice")).await().atMost(AWAIT);
            var second = resolver.resolve(request(new GeoPoint(21.2501, 81.6301), "wheat"))
                    .await()
                    .atMost(AWAIT);

            assertEquals(WeatherCondition.OVERCAST, first.weather());
            assertEquals(WeatherCondition.OVERCAST, second.weather());
            assertEquals(1, lookups.get());
        }

        @Test
        @DisplayName("should not remember unknown conditions")
        void shouldNotRememberUnknown() {
            reported = WeatherCondition.UNKNOWN;
            var resolver = resolver();

            resolver.resolve(request(RAIPUR, "rice")).await().atMost(AWAIT);
            resolver.resolve(request(RAIPUR, "rice")).await().atMost(AWAIT);

            assertEquals(2, lookups.get());
        }

        @Test
        @DisplayName("should fall back to unknown when the lookup fails")
        void shouldFallBackToUnknownOnFailure() {
            var resolver = resolver(
                    (location, date) -> Uni.createFrom().failure(new IllegalStateException("upstream down")),
                    Duration.ofSeconds(1));

            var context = resolver.resolve(request(RAIPUR, "rice")).await().atMost(AWAIT);

            assertEquals(WeatherCondition.UNKNOWN, context.weather());
        }

        @Test
        @DisplayName("should fall back to unknown when the lookup times out")
        void shouldFallBackToUnknownOnTimeout() {
            var resolver = resolver((location, date) -> Uni.createFrom().nothing(), Duration.ofMillis(50));

            var context = resolver.resolve(request(RAIPUR, "rice")).await().atMost(AWAIT);

            assertEquals(WeatherCondition.UNKNOWN, context.weather());
        }

        @Test
        @DisplayName("should fall back to unknown when the lookup throws")
        void shouldFallBackToUnknownWhenLookupThrows() {
            var resolver = resolver(
                    (location, date) -> {
                        throw new IllegalStateException("misconfigured");
                    },
                    Duration.ofSeconds(1));

            var context = resolver.resolve(request(RAIPUR, "rice")).await().atMost(AWAIT);

            assertEquals(WeatherCondition.UNKNOWN, context.weather());
        }

        @Test
        @DisplayName("should combine every classification into the context")
        void shouldCombineClassifications() {
            reported = WeatherCondition.RAIN;

            var context = resolver().resolve(request(REMOTE, "lettuce")).await().atMost(AWAIT);

            assertEquals(WeatherCondition.RAIN, context.weather());
            assertEquals(RemotenessClass.SPARSE, context.remoteness());
            assertEquals(ValueClass.STANDARD, context.value());
            assertEquals(GrowthRateClass.RAPID, context.growthRate());
            assertFalse(context.inPriorityArea());
        }

        @Test
        @DisplayName("should flag locations inside a priority area")
        void shouldFlagPriorityArea() {
            var context = resolver().resolve(request(KANKER_FIELD, "millet")).await().atMost(AWAIT);

            assertTrue(context.inPriorityArea());
            assertEquals(ValueClass.HIGH_VALUE, context.value());
        }
    }
}
