package com.vigil.database.issue;

import com.vigil.database.JsonColumns;
import com.vigil.monitoring.issue.AgentIssue;
import com.vigil.monitoring.issue.IssueSeverity;
import com.vigil.monitoring.issue.IssueStatus;
import com.vigil.monitoring.issue.IssueStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link IssueStore} backed by the {@code agent_issues} table. Enums are stored by name and
 * details as JSON text.
 */
public class JdbcIssueStore implements IssueStore {

    private static final String COLUMNS =
            "issue_id, agent_name, severity, category, title, description, details, status, detected_at, "
                    + "acknowledged_at, resolved_at, resolution, fingerprint, occurrence_count, last_seen_at, "
                    + "sla_target, destination_id";

    private static final String ACTIVE =
            "status NOT IN ("
                    + Arrays.stream(IssueStatus.values())
                            .filter(IssueStatus::isTerminal)
                            .map(status -> "'" + status.name() + "'")
                            .collect(Collectors.joining(", "))
                    + ")";

    private static final String UPDATE =
            "UPDATE agent_issues SET agent_name = ?, severity = ?, category = ?, title = ?, description = ?, "
                    + "details = ?, status = ?, detected_at = ?, acknowledged_at = ?, resolved_at = ?, "
                    + "resolution = ?, fingerprint = ?, occurrence_count = ?, last_seen_at = ?, sla_target = ?, "
                    + "destination_id = ? WHERE issue_id = ?";

    private static final String INSERT =
            "INSERT INTO agent_issues (agent_name, severity, category, title, description, details, status, "
                    + "detected_at, acknowledged_at, resolved_at, resolution, fingerprint, occurrence_count, "
                    + "last_seen_at, sla_target, destination_id, issue_id) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public JdbcIssueStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    @Override
    public Optional<AgentIssue> findById(String issueId) {
        return jdbcTemplate
                .query("SELECT " + COLUMNS + " FROM agent_issues WHERE issue_id = ?", this::map, issueId)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<AgentIssue> findActiveByFingerprint(String fingerprint) {
        return jdbcTemplate
                .query(
                        "SELECT " + COLUMNS + " FROM agent_issues WHERE fingerprint = ? AND " + ACTIVE
                                + " ORDER BY detected_at DESC",
                        this::map,
                        fingerprint)
                .stream()
                .findFirst();
    }

    @Override
    public List<AgentIssue> findActive() {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM agent_issues WHERE " + ACTIVE + " ORDER BY detected_at", this::map);
    }

    @Override
    public List<AgentIssue> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM agent_issues ORDER BY detected_at", this::map);
    }

    @Override
    public AgentIssue save(AgentIssue issue) {
        Object[] values = {
            issue.agentName(),
            issue.severity().name(),
            issue.category(),
            issue.title(),
            issue.description(),
            json.write(issue.details()),
            issue.status().name(),
            JsonColumns.timestamp(issue.detectedAt()),
            JsonColumns.timestamp(issue.acknowledgedAt()),
            JsonColumns.timestamp(issue.resolvedAt()),
            issue.resolution(),
            issue.fingerprint(),
            issue.occurrenceCount(),
            JsonColumns.timestamp(issue.lastSeenAt()),
            JsonColumns.timestamp(issue.slaTarget()),
            issue.destinationId(),
            issue.issueId()
        };
        if (jdbcTemplate.update(UPDATE, values) == 0) {
            jdbcTemplate.update(INSERT, values);
        }
        return issue;
    }

    @Override
    public int countByIdPrefix(String prefix) {
        Integer count =
                jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM agent_issues WHERE issue_id LIKE ?", Integer.class, prefix + "%");
        return count != null ? count : 0;
    }

    private AgentIssue map(ResultSet rs, int row) throws SQLException {
        return new AgentIssue(
                rs.getString("issue_id"),
                rs.getString("agent_name"),
                IssueSeverity.valueOf(rs.getString("severity")),
                rs.getString("category"),
                rs.getString("title"),
                rs.getString("description"),
                json.read(rs.getString("details")),
                IssueStatus.valueOf(rs.getString("status")),
                JsonColumns.instant(rs.getTimestamp("detected_at")),
                JsonColumns.instant(rs.getTimestamp("acknowledged_at")),
                JsonColumns.instant(rs.getTimestamp("resolved_at")),
                rs.getString("resolution"),
                rs.getString("fingerprint"),
                rs.getInt("occurrence_count"),
                JsonColumns.instant(rs.getTimestamp("last_seen_at")),
                JsonColumns.instant(rs.getTimestamp("sla_target")),
                rs.getString("destination_id"));
    }
}
