package com.vigil.monitoring.agent;

import java.util.Map;

/**
 * What one agent invocation produced.
 *
 * @param success whether the agent considers its run successful
 * @param summary one-line description
 * @param details structured result for the API
 */
public record AgentOutcome(boolean success, String summary, Map<String, Object> details) {

    public AgentOutcome {
        details = details != null ? details : Map.of();
    }

    public static AgentOutcome success(String summary, Map<String, Object> details) {
        return new AgentOutcome(true, summary, details);
    }

    public static AgentOutcome failure(String summary, Map<String, Object> details) {
        return new AgentOutcome(false, summary, details);
    }
}
