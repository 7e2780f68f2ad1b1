package com.vigil.monitoring.agent;

/**
 * Thrown when an agent key is not registered.
 */
public class UnknownAgentException extends RuntimeException {

    private final String agentKey;

    public UnknownAgentException(String agentKey) {
        super("Unknown agent: " + agentKey);
        this.agentKey = agentKey;
    }

    public String agentKey() {
        return agentKey;
    }
}
