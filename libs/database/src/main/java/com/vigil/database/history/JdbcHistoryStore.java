package com.vigil.database.history;

import com.vigil.database.JsonColumns;
import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.monitoring.history.HistoryStoreException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * {@link HistoryStore} backed by the {@code agent_history} table. Metrics are stored as JSON text.
 */
public class JdbcHistoryStore implements HistoryStore {

    private static final String INSERT =
            "INSERT INTO agent_history (agent_name, action, destination_id, recorded_at, status, description, metrics) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT =
            "SELECT id, agent_name, action, destination_id, recorded_at, status, description, metrics "
                    + "FROM agent_history WHERE agent_name = ? AND action = ? ";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public JdbcHistoryStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    @Override
    public HistoryEntry append(HistoryEntry entry) {
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            String metrics = json.write(entry.metrics());
            jdbcTemplate.update(
                    connection -> {
                        PreparedStatement ps = connection.prepareStatement(INSERT, new String[] {"id"});
                        ps.setString(1, entry.agentName());
                        ps.setString(2, entry.action());
                        ps.setString(3, entry.destinationId());
                        ps.setTimestamp(4, JsonColumns.timestamp(entry.timestamp()));
                        ps.setString(5, entry.status());
                        ps.setString(6, entry.description());
                        ps.setString(7, metrics);
                        return ps;
                    },
                    keys);
        } catch (DataAccessException | IllegalArgumentException e) {
            throw new HistoryStoreException(
                    "Could not append history for " + entry.agentName() + "/" + entry.action(), e);
        }
        Number id = keys.getKey();
        return id != null ? entry.withId(id.longValue()) : entry;
    }

    @Override
    public List<HistoryEntry> recent(String agentName, String action, int limit) {
        try {
            return jdbcTemplate.query(
                    SELECT + "ORDER BY recorded_at DESC, id DESC LIMIT ?", this::map, agentName, action, limit);
        } catch (DataAccessException e) {
            throw new HistoryStoreException("Could not read history for " + agentName + "/" + action, e);
        }
    }

    @Override
    public List<HistoryEntry> since(String agentName, String action, Instant since) {
        try {
            return jdbcTemplate.query(
                    SELECT + "AND recorded_at >= ? ORDER BY recorded_at DESC, id DESC",
                    this::map,
                    agentName,
                    action,
                    JsonColumns.timestamp(since));
        } catch (DataAccessException e) {
            throw new HistoryStoreException("Could not read history for " + agentName + "/" + action, e);
        }
    }

    private HistoryEntry map(ResultSet rs, int row) throws SQLException {
        return new HistoryEntry(
                rs.getLong("id"),
                rs.getString("agent_name"),
                rs.getString("action"),
                rs.getString("destination_id"),
                JsonColumns.instant(rs.getTimestamp("recorded_at")),
                rs.getString("status"),
                rs.getString("description"),
                json.read(rs.getString("metrics")));
    }
}
