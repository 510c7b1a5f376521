package canopy.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * RFC 7807 Problem Details body.
 *
 * <p>Static factories cover the errors the API can return. Rendered by Jackson as
 * {@code application/problem+json}.
 *
 * @param type   problem type URI, {@code about:blank} for plain HTTP errors
 * @param title  short summary of the problem type
 * @param status HTTP status code
 * @param detail explanation specific to this occurrence
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiProblem(String type, String title, int status, String detail) {

    public static final String MEDIA_TYPE = "application/problem+json";

    private static final String BLANK_TYPE = "about:blank";

    public static ApiProblem validationError(String detail) {
        return of(Status.BAD_REQUEST, "Validation Error", detail);
    }

    public static ApiProblem notFound(String resourceType, String resourceId) {
        return of(Status.NOT_FOUND, "%s Not Found".formatted(resourceType), "%s not found: %s"
                .formatted(resourceType, resourceId));
    }

    public static ApiProblem tooManyRequests(long retryAfterSeconds) {
        return of(
                Status.TOO_MANY_REQUESTS,
                "Too Many Requests",
                "Rate limit exceeded, retry after %d seconds".formatted(retryAfterSeconds));
    }

    public static ApiProblem serviceUnavailable(String detail) {
        return of(Status.SERVICE_UNAVAILABLE, "Service Unavailable", detail);
    }

    private static ApiProblem of(Status status, String title, String detail) {
        return new ApiProblem(BLANK_TYPE, title, status.getStatusCode(), detail);
    }
}
