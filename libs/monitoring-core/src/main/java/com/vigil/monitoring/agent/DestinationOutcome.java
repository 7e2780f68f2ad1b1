package com.vigil.monitoring.agent;

import java.util.Map;

/**
 * Result of running an agent for one destination (or once, for shared agents, with a null id).
 */
public record DestinationOutcome(String destinationId, boolean success, long durationMs, String summary,
                                 String error, Map<String, Object> details) {

    public DestinationOutcome {
        details = details != null ? details : Map.of();
    }
}
