package canopy.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import canopy.core.exception.ChainExhaustedException;
import canopy.core.exception.RateLimitExceededException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>These mappers prevent the engine's exceptions from surfacing as 500 Internal
 * Server Error when a more precise status code applies.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    static final String RETRY_AFTER = "Retry-After";

    @ServerExceptionMapper
    public Response mapRateLimitExceeded(RateLimitExceededException e) {
        return Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type(ApiProblem.MEDIA_TYPE)
                .header(RETRY_AFTER, String.valueOf(e.retryAfterSeconds()))
                .entity(ApiProblem.tooManyRequests(e.retryAfterSeconds()))
                .build();
    }

    @ServerExceptionMapper
    public Response mapChainExhausted(ChainExhaustedException e) {
        LOG.warnv("Estimate unavailable: {0}", e.getMessage());
        return toResponse(ApiProblem.serviceUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ApiProblem.validationError(e.getMessage()));
    }

    private Response toResponse(ApiProblem problem) {
        return Response.status(problem.status())
                .type(ApiProblem.MEDIA_TYPE)
                .entity(problem)
                .build();
    }
}
