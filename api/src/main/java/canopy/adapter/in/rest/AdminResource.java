package canopy.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import canopy.adapter.in.problem.ApiProblem;
import canopy.core.port.in.MaintenanceUseCase;

/**
 * REST resource for cache and rate limiter administration.
 *
 * <p>This adapter handles HTTP-specific concerns only and delegates to
 * {@link MaintenanceUseCase}.
 */
@Path("/api/admin")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AdminResource {

    private final MaintenanceUseCase maintenance;

    @Inject
    public AdminResource(MaintenanceUseCase maintenance) {
        this.maintenance = maintenance;
    }

    @DELETE
    @Path("/cache")
    public Response clearCache() {
        maintenance.clearCache();
        return Response.noContent().build();
    }

    @POST
    @Path("/cache/purge")
    public Map<String, Integer> purgeExpiredCache() {
        return Map.of("purged", maintenance.purgeExpiredCache());
    }

    @DELETE
    @Path("/rate-limit")
    public Response resetAllClients() {
        maintenance.resetAllClients();
        return Response.noContent().build();
    }

    /**
     * Discard a client's rate limit windows.
     *
     * @param clientId the client identity
     * @return 204 No Content, or 404 if the client had no tracked state
     */
    @DELETE
    @Path("/rate-limit/{clientId}")
    public Response resetClient(@PathParam("clientId") String clientId) {
        if (maintenance.resetClient(clientId)) {
            return Response.noContent().build();
        }
        return Response.status(Response.Status.NOT_FOUND)
                .type(ApiProblem.MEDIA_TYPE)
                .entity(ApiProblem.notFound("Client", clientId))
                .build();
    }
}
