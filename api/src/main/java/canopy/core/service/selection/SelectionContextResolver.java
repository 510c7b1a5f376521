package canopy.core.service.selection;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import canopy.core.cache.CaffeineLocalCache;
import canopy.core.cache.LocalCache;
import canopy.core.config.SelectionConfig;
import canopy.core.config.WeatherConfig;
import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.provider.BoundingBox;
import canopy.core.model.selection.GrowthRateClass;
import canopy.core.model.selection.RemotenessClass;
import canopy.core.model.selection.SelectionContext;
import canopy.core.model.selection.ValueClass;
import canopy.core.model.selection.WeatherCondition;
import canopy.core.port.out.WeatherLookup;

/**
 * Classifies a request into the {@link SelectionContext} the selection policy works on.
 *
 * <p>Weather comes from the request when the caller supplied it, otherwise from the
 * weather lookup. Looked-up conditions are reused for the same rounded location and
 * date. A lookup that fails or runs past its timeout yields {@link WeatherCondition#UNKNOWN}
 * and is not remembered.
 */
@ApplicationScoped
public class SelectionContextResolver {

    private static final Logger LOG = Logger.getLogger(SelectionContextResolver.class);

    private static final int WEATHER_KEY_DECIMALS = 2;

    private final WeatherLookup weatherLookup;
    private final Duration weatherTimeout;
    private final LocalCache<String, WeatherCondition> weatherCache;
    private final Set<String> highValueCrops;
    private final Set<String> rapidGrowthCrops;
    private final List<BoundingBox> priorityAreas;
    private final List<GeoPoint> referenceSites;
    private final double remoteDistanceKm;

    @Inject
    public SelectionContextResolver(SelectionConfig config, WeatherConfig weatherConfig, WeatherLookup weatherLookup) {
        this(
                config,
                weatherConfig.timeout(),
                weatherLookup,
                new CaffeineLocalCache<>(config.weatherCacheTtl(), config.weatherCacheMaxEntries()));
    }

    SelectionContextResolver(
            SelectionConfig config,
            Duration weatherTimeout,
            WeatherLookup weatherLookup,
            LocalCache<String, WeatherCondition> weatherCache) {
        this.weatherLookup = weatherLookup;
        this.weatherTimeout = weatherTimeout;
        this.weatherCache = weatherCache;
        this.highValueCrops = upperCase(config.highValueCrops());
        this.rapidGrowthCrops = upperCase(config.rapidGrowthCrops());
        this.priorityAreas = config.priorityAreas().stream()
                .map(area -> new BoundingBox(
                        area.minLatitude(), area.maxLatitude(), area.minLongitude(), area.maxLongitude()))
                .toList();
        this.referenceSites = config.referenceSites().stream()
                .map(site -> new GeoPoint(site.latitude(), site.longitude()))
                .toList();
        this.remoteDistanceKm = config.remoteDistanceKm();
    }

    /**
     * Classifies the request.
     *
     * @param request the estimate request
     * @return the selection context; never fails
     */
    public Uni<SelectionContext> resolve(EstimateRequest request) {
        final var remoteness = classifyRemoteness(request.location());
        final var value = classifyValue(request);
        final var growth = classifyGrowth(request);
        final var inPriorityArea = inPriorityArea(request.location());
        return resolveWeather(request)
                .map(weather -> new SelectionContext(weather, remoteness, value, growth, inPriorityArea));
    }

    RemotenessClass classifyRemoteness(GeoPoint location) {
        if (referenceSites.isEmpty()) {
            return RemotenessClass.WELL_COVERED;
        }
        final var nearby = referenceSites.stream().anyMatch(site -> site.distanceKm(location) <= remoteDistanceKm);
        return nearby ? RemotenessClass.WELL_COVERED : RemotenessClass.SPARSE;
    }

    ValueClass classifyValue(EstimateRequest request) {
        if (highValueCrops.contains(request.crop())) {
            return ValueClass.HIGH_VALUE;
        }
        return inPriorityArea(request.location()) ? ValueClass.HIGH_VALUE : ValueClass.STANDARD;
    }

    boolean inPriorityArea(GeoPoint location) {
        return priorityAreas.stream().anyMatch(area -> area.contains(location));
    }

    GrowthRateClass classifyGrowth(EstimateRequest request) {
        return rapidGrowthCrops.contains(request.crop()) ? GrowthRateClass.RAPID : GrowthRateClass.NORMAL;
    }

    private Uni<WeatherCondition> resolveWeather(EstimateRequest request) {
        if (request.weatherHint().isPresent()) {
            return Uni.createFrom().item(request.weatherHint().get());
        }

        final var location = request.location();
        final var key = location.roundedLatitude(WEATHER_KEY_DECIMALS) + "|"
                + location.roundedLongitude(WEATHER_KEY_DECIMALS) + "|" + request.date();
        final var cached = weatherCache.get(key);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }

        return Uni.createFrom()
                .deferred(() -> weatherLookup.lookup(location, request.date()))
                .ifNoItem()
                .after(weatherTimeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Weather lookup timed out after {0}ms", weatherTimeout.toMillis());
                    return WeatherCondition.UNKNOWN;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Weather lookup failed: {0}", error.getMessage());
                    return WeatherCondition.UNKNOWN;
                })
                .onItem()
                .ifNull()
                .continueWith(WeatherCondition.UNKNOWN)
                .invoke(weather -> {
                    if (weather != WeatherCondition.UNKNOWN) {
                        weatherCache.put(key, weather);
                    }
                });
    }

    private static Set<String> upperCase(Set<String> values) {
        return values.stream()
                .map(v -> v.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
