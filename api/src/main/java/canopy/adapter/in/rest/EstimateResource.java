package canopy.adapter.in.rest;

import java.time.Clock;
import java.time.LocalDate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import canopy.adapter.in.dto.EstimateRequestDto;
import canopy.adapter.in.dto.EstimateResponse;
import canopy.core.exception.RateLimitExceededException;
import canopy.core.port.in.EstimateUseCase;
import canopy.core.port.out.RateLimiter;

/**
 * REST resource for nutrient estimates.
 *
 * <p>Every request is admitted against the caller's rate limit windows before it
 * reaches the fallback chain. A denied request fails with 429 and a
 * {@code Retry-After} header.
 */
@Path("/api/estimates")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EstimateResource {

    static final String CLIENT_ID_HEADER = "X-Client-Id";
    static final String ANONYMOUS = "anonymous";

    private final EstimateUseCase estimates;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    @Inject
    public EstimateResource(EstimateUseCase estimates, RateLimiter rateLimiter, Clock clock) {
        this.estimates = estimates;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    /**
     * Produce an estimate.
     *
     * @param clientId caller identity, {@code anonymous} when absent
     * @param request  the estimate request
     * @return the estimate with its provenance
     */
    @POST
    public Uni<EstimateResponse> estimate(@HeaderParam(CLIENT_ID_HEADER) String clientId, EstimateRequestDto request) {
        final var decision = rateLimiter.admit(clientIdOrAnonymous(clientId));
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision.retryAfterSeconds());
        }

        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        final var model = request.toModel(LocalDate.now(clock));

        return estimates.handle(model).map(EstimateResponse::fromModel);
    }

    static String clientIdOrAnonymous(String clientId) {
        return clientId == null || clientId.isBlank() ? ANONYMOUS : clientId.trim();
    }
}
