package canopy.adapter.out.weather;

import java.time.LocalDate;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import canopy.core.config.WeatherConfig;
import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.selection.WeatherCondition;
import canopy.core.port.out.WeatherLookup;

/**
 * Weather lookup against an HTTP upstream.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET {endpoint}?lat=21.85&lon=82.0&date=2024-06-01
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * { "condition": "cloudy" }
 * }</pre>
 *
 * <p>Without a configured endpoint, or when the upstream misbehaves, the
 * condition is {@link WeatherCondition#UNKNOWN}.
 */
@ApplicationScoped
public class HttpWeatherLookup implements WeatherLookup {

    private static final Logger LOG = Logger.getLogger(HttpWeatherLookup.class);

    private final WebClient webClient;
    private final WeatherConfig config;

    @Inject
    public HttpWeatherLookup(Vertx vertx, WeatherConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<WeatherCondition> lookup(GeoPoint location, LocalDate date) {
        final var endpoint = config.endpoint().filter(url -> !url.isBlank());
        if (endpoint.isEmpty()) {
            return Uni.createFrom().item(WeatherCondition.UNKNOWN);
        }

        return webClient
                .getAbs(endpoint.get())
                .addQueryParam("lat", String.valueOf(location.latitude()))
                .addQueryParam("lon", String.valueOf(location.longitude()))
                .addQueryParam("date", date.toString())
                .putHeader("Accept", "application/json")
                .timeout(config.timeout().toMillis())
                .send()
                .map(response -> {
                    if (response.statusCode() != 200) {
                        LOG.warnf("Weather lookup failed: status=%d", response.statusCode());
                        return WeatherCondition.UNKNOWN;
                    }
                    return parseCondition(response.bodyAsString());
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Weather lookup error: %s", error.getMessage());
                    return WeatherCondition.UNKNOWN;
                });
    }

    static WeatherCondition parseCondition(String body) {
        if (body == null || body.isBlank()) {
            return WeatherCondition.UNKNOWN;
        }
        try {
            return WeatherCondition.parse(new JsonObject(body).getString("condition"));
        } catch (DecodeException | ClassCastException e) {
            LOG.debugf("Unreadable weather response: %s", e.getMessage());
            return WeatherCondition.UNKNOWN;
        }
    }

    @PreDestroy
    void close() {
        webClient.close();
    }
}
