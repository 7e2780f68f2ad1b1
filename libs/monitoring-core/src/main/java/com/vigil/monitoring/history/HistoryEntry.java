package com.vigil.monitoring.history;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One persisted record of agent activity: a health run, a smoke test run, a backup check, a
 * correlation report or an audit line.
 *
 * @param id            store-assigned identifier, null before the entry is appended
 * @param agentName     agent that produced the entry
 * @param action        what happened, e.g. {@code health_check}
 * @param destinationId destination the entry concerns, null for shared runs
 * @param timestamp     when it happened
 * @param status        outcome such as {@code healthy} or {@code completed}; may be null
 * @param description   human-readable summary
 * @param metrics       structured payload (never null)
 */
public record HistoryEntry(
        Long id,
        String agentName,
        String action,
        String destinationId,
        Instant timestamp,
        String status,
        String description,
        Map<String, Object> metrics
) {

    public HistoryEntry {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName must not be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        metrics = metrics == null || metrics.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static HistoryEntry of(String agentName, String action, Instant timestamp, String status,
                                  String description, Map<String, Object> metrics) {
        return new HistoryEntry(null, agentName, action, null, timestamp, status, description, metrics);
    }

    public HistoryEntry withId(long newId) {
        return new HistoryEntry(newId, agentName, action, destinationId, timestamp, status, description, metrics);
    }

    public HistoryEntry forDestination(String newDestinationId) {
        return new HistoryEntry(id, agentName, action, newDestinationId, timestamp, status, description, metrics);
    }
}
