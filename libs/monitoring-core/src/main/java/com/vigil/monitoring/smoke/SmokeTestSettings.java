package com.vigil.monitoring.smoke;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Endpoints and thresholds of the smoke tests. Paths may contain {@code {id}} for the resource
 * taken from the list response.
 */
public record SmokeTestSettings(
        URI apiBaseUrl,
        String healthPath,
        String resourceListPath,
        String resourceDetailPath,
        String subResourcePath,
        String destinationHeader,
        int listLimit,
        int frontendMinBytes,
        long minScheduledJobs,
        Duration timeout,
        Duration slowTimeout,
        String alertChannel,
        List<String> requiredChannelVariables
) {

    public SmokeTestSettings {
        if (apiBaseUrl == null) {
            throw new IllegalArgumentException("apiBaseUrl must not be null");
        }
        healthPath = healthPath != null ? healthPath : "/api/v1/health";
        resourceListPath = resourceListPath != null ? resourceListPath : "/api/v1/pois";
        resourceDetailPath = resourceDetailPath != null ? resourceDetailPath : "/api/v1/pois/{id}";
        subResourcePath = subResourcePath != null ? subResourcePath : "/api/v1/pois/{id}/reviews";
        destinationHeader = destinationHeader != null ? destinationHeader : "X-Destination-ID";
        listLimit = listLimit > 0 ? listLimit : 3;
        frontendMinBytes = frontendMinBytes > 0 ? frontendMinBytes : 1000;
        minScheduledJobs = minScheduledJobs > 0 ? minScheduledJobs : 35;
        timeout = timeout != null ? timeout : Duration.ofSeconds(5);
        slowTimeout = slowTimeout != null ? slowTimeout : Duration.ofSeconds(10);
        alertChannel = alertChannel != null ? alertChannel : "sms";
        requiredChannelVariables = requiredChannelVariables != null ? List.copyOf(requiredChannelVariables) : List.of();
    }

    public static SmokeTestSettings defaults(URI apiBaseUrl) {
        return new SmokeTestSettings(apiBaseUrl, null, null, null, null, null, 0, 0, 0, null, null, null, null);
    }
}
