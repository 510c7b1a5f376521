package canopy.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import canopy.adapter.in.dto.CacheStatsDto;
import canopy.adapter.in.dto.ClientRateLimitDto;
import canopy.adapter.in.dto.FallbackStatsDto;
import canopy.adapter.in.dto.RateLimitStatsDto;
import canopy.adapter.in.problem.ApiProblem;
import canopy.core.port.in.StatisticsQuery;
import canopy.core.port.out.RateLimiter;

/**
 * REST resource exposing cache, fallback and rate limiting statistics.
 */
@Path("/api/stats")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class StatsResource {

    private final StatisticsQuery statistics;
    private final RateLimiter rateLimiter;

    @Inject
    public StatsResource(StatisticsQuery statistics, RateLimiter rateLimiter) {
        this.statistics = statistics;
        this.rateLimiter = rateLimiter;
    }

    @GET
    @Path("/cache")
    public CacheStatsDto cache() {
        return CacheStatsDto.fromModel(statistics.cacheStats());
    }

    @GET
    @Path("/fallback")
    public FallbackStatsDto fallback() {
        return FallbackStatsDto.fromModel(statistics.fallbackStats());
    }

    @GET
    @Path("/rate-limit")
    public RateLimitStatsDto rateLimit() {
        return RateLimitStatsDto.fromModel(statistics.rateLimitStats(), rateLimiter.isEnabled());
    }

    /**
     * Get one client's current windows.
     *
     * @param clientId the client identity
     * @return the windows, or 404 if the client has no tracked state
     */
    @GET
    @Path("/rate-limit/{clientId}")
    public Response clientRateLimit(@PathParam("clientId") String clientId) {
        return statistics
                .clientRateLimitStatus(clientId)
                .map(status -> Response.ok(ClientRateLimitDto.fromModel(status)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .type(ApiProblem.MEDIA_TYPE)
                        .entity(ApiProblem.notFound("Client", clientId))
                        .build());
    }
}
