package canopy.adapter.out.provider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import canopy.core.exception.ProviderException;
import canopy.core.exception.ProviderInvalidResponseException;
import canopy.core.exception.ProviderTimeoutException;
import canopy.core.exception.ProviderUnavailableException;
import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.ProviderReading;
import canopy.core.model.provider.ProviderDescriptor;
import canopy.core.port.out.ReadingProvider;

/**
 * Provider adapter that queries an HTTP upstream.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET {endpoint}?lat=21.85&lon=82.0&date=2024-06-01&crop=RICE
 * Accept: application/json
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "nutrients": { "nitrogen": 245.0, "phosphorus": 28.5, "potassium": 190.0 },
 *   "indices": { "ndvi": 0.62, "ndwi": 0.11 }
 * }
 * }</pre>
 *
 * <p>Failure mapping: 5xx, other non-2xx statuses and connection errors are
 * UNAVAILABLE; a body that is not JSON, lacks {@code nutrients}, or carries a
 * non-numeric value is INVALID_RESPONSE; no answer by the deadline is TIMEOUT.
 */
public final class HttpReadingProvider implements ReadingProvider {

    private static final Logger LOG = Logger.getLogger(HttpReadingProvider.class);

    private final WebClient webClient;
    private final ProviderDescriptor descriptor;
    private final String endpoint;
    private final Clock clock;

    public HttpReadingProvider(WebClient webClient, ProviderDescriptor descriptor, String endpoint, Clock clock) {
        this.webClient = webClient;
        this.descriptor = descriptor;
        this.endpoint = endpoint;
        this.clock = clock;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public Uni<ProviderReading> fetch(EstimateRequest request, Instant deadline) {
        final var budget = Duration.between(clock.instant(), deadline);
        final var timeoutMillis = Math.max(1, budget.toMillis());

        final var httpRequest = webClient
                .getAbs(endpoint)
                .addQueryParam("lat", String.valueOf(request.location().latitude()))
                .addQueryParam("lon", String.valueOf(request.location().longitude()))
                .addQueryParam("date", request.date().toString())
                .addQueryParam("crop", request.crop())
                .putHeader("Accept", "application/json")
                .timeout(timeoutMillis);
        request.params().forEach(httpRequest::addQueryParam);

        LOG.debugf("Calling provider: name=%s, url=%s, timeout=%dms", name(), endpoint, timeoutMillis);

        return httpRequest
                .send()
                .onFailure()
                .transform(error -> classify(name(), Duration.ofMillis(timeoutMillis), error))
                .map(response -> parse(descriptor, response.statusCode(), response.bodyAsString()));
    }

    static ProviderException classify(String providerName, Duration timeout, Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        // Vert.x reports request timeouts with its own exception types
        if (error instanceof TimeoutException || error.getClass().getSimpleName().contains("Timeout")) {
            return new ProviderTimeoutException(providerName, timeout);
        }
        return new ProviderUnavailableException(
                providerName, "Connection to provider failed: " + error.getMessage(), error);
    }

    /**
     * Turns an upstream response into a reading.
     *
     * @param descriptor the provider's descriptor, supplies confidence and resolution
     * @param status     HTTP status code
     * @param body       response body, may be null
     * @return the reading
     * @throws ProviderException describing why the response is unusable
     */
    static ProviderReading parse(ProviderDescriptor descriptor, int status, String body) {
        final var name = descriptor.name();
        if (status < 200 || status >= 300) {
            throw new ProviderUnavailableException(name, "Provider returned status " + status);
        }
        if (body == null || body.isBlank()) {
            throw new ProviderInvalidResponseException(name, "Provider returned an empty body");
        }

        final JsonObject json;
        try {
            json = new JsonObject(body);
        } catch (DecodeException e) {
            throw new ProviderInvalidResponseException(name, "Provider returned malformed JSON", e);
        }

        final var nutrients = numbers(name, json, "nutrients");
        if (nutrients.isEmpty()) {
            throw new ProviderInvalidResponseException(name, "Provider response has no nutrients");
        }
        final var indices = json.containsKey("indices") ? numbers(name, json, "indices") : Map.<String, Double>of();

        return new ProviderReading(name, nutrients, indices, descriptor.confidence(), descriptor.resolutionLabel());
    }

    private static Map<String, Double> numbers(String providerName, JsonObject json, String field) {
        final var value = json.getValue(field);
        if (!(value instanceof JsonObject object)) {
            throw new ProviderInvalidResponseException(providerName, "Field '%s' is missing or not an object"
                    .formatted(field));
        }

        final var result = new HashMap<String, Double>();
        for (final var entry : object) {
            if (!(entry.getValue() instanceof Number number)) {
                throw new ProviderInvalidResponseException(
                        providerName, "Field '%s.%s' is not numeric".formatted(field, entry.getKey()));
            }
            result.put(entry.getKey(), number.doubleValue());
        }
        return result;
    }
}
