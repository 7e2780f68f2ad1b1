package com.vigil.monitoring.agent;

/**
 * Catalog entry of an agent.
 *
 * @param key              stable identifier used in URLs and history, e.g. {@code health-monitor}
 * @param name             display name
 * @param label            short role label
 * @param category         agent group (for example {@code A} operational or {@code B} analytical)
 * @param version          implementation version
 * @param destinationAware whether the agent runs once per destination
 */
public record AgentDescriptor(String key, String name, String label, String category, String version,
                              boolean destinationAware) {

    public AgentDescriptor {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        name = name != null ? name : key;
        version = version != null ? version : "1.0.0";
    }
}
