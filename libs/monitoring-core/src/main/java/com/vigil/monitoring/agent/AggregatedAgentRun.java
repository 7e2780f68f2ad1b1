package com.vigil.monitoring.agent;

import java.time.Instant;
import java.util.List;

/**
 * Uniform result of {@link DestinationRunner#run(String)}.
 */
public record AggregatedAgentRun(
        String agentKey,
        String agentName,
        String category,
        String version,
        boolean success,
        int destinationsTotal,
        int destinationsSucceeded,
        int destinationsFailed,
        List<DestinationOutcome> perDestination,
        long durationMs,
        Instant timestamp,
        String error
) {

    public AggregatedAgentRun {
        perDestination = perDestination != null ? List.copyOf(perDestination) : List.of();
    }

    static AggregatedAgentRun of(AgentDescriptor agent, List<DestinationOutcome> outcomes, long durationMs,
                                 Instant timestamp) {
        int succeeded = (int) outcomes.stream().filter(DestinationOutcome::success).count();
        int failed = outcomes.size() - succeeded;
        return new AggregatedAgentRun(agent.key(), agent.name(), agent.category(), agent.version(),
                failed == 0, outcomes.size(), succeeded, failed, outcomes,
                durationMs, timestamp, null);
    }

    static AggregatedAgentRun failed(AgentDescriptor agent, String error, long durationMs, Instant timestamp) {
        return new AggregatedAgentRun(agent.key(), agent.name(), agent.category(), agent.version(),
                false, 0, 0, 0, List.of(), durationMs, timestamp, error);
    }
}
