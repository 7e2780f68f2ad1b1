package com.vigil.healthmonitor.config;

import com.vigil.monitoring.agent.AggregatedAgentRun;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shapes the audit entry written after every agent run. */
final class AgentRunAudit {

    static final String ACTION = "agent_run";

    private AgentRunAudit() {}

    static String describe(AggregatedAgentRun run) {
        if (run.error() != null) {
            return run.agentName() + " failed: " + run.error();
        }
        return run.agentName() + " ran for " + run.destinationsTotal() + " destination(s), "
                + run.destinationsFailed() + " failed";
    }

    static Map<String, Object> metadata(AggregatedAgentRun run) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", run.success() ? "completed" : "failed");
        metadata.put("version", run.version());
        metadata.put("durationMs", run.durationMs());
        metadata.put("destinationsSucceeded", run.destinationsSucceeded());
        metadata.put("destinationsFailed", run.destinationsFailed());
        return metadata;
    }
}
