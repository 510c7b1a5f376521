package canopy.adapter.in.dto;

import canopy.core.model.ratelimit.ClientRateLimitStatus;

/**
 * DTO for one client's rate limit windows.
 */
public record ClientRateLimitDto(
        String clientId,
        long currentRequestsMinute,
        long maxRequestsMinute,
        long minuteRemaining,
        long currentRequestsHour,
        long maxRequestsHour,
        long hourRemaining) {

    public static ClientRateLimitDto fromModel(ClientRateLimitStatus status) {
        return new ClientRateLimitDto(
                status.clientId(),
                status.currentRequestsMinute(),
                status.maxRequestsMinute(),
                status.minuteRemaining(),
                status.currentRequestsHour(),
                status.maxRequestsHour(),
                status.hourRemaining());
    }
}
