package com.vigil.monitoring.history;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of {@link HistoryEntry} records. All queries return newest first.
 */
public interface HistoryStore {

    /**
     * Persists the entry and returns it with its assigned id.
     *
     * @throws HistoryStoreException if the entry could not be written
     */
    HistoryEntry append(HistoryEntry entry);

    /**
     * Returns up to {@code limit} entries for the agent and action, newest first.
     */
    List<HistoryEntry> recent(String agentName, String action, int limit);

    /**
     * Returns all entries for the agent and action at or after {@code since}, newest first.
     */
    List<HistoryEntry> since(String agentName, String action, Instant since);

    default Optional<HistoryEntry> latest(String agentName, String action) {
        return recent(agentName, action, 1).stream().findFirst();
    }
}
