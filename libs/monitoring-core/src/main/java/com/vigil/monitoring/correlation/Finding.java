package com.vigil.monitoring.correlation;

import com.vigil.monitoring.issue.IssueSeverity;

import java.util.List;
import java.util.Map;

/**
 * A cross-agent correlation or single-agent insight.
 *
 * @param type        stable identifier, e.g. {@code issue_backlog}
 * @param severity    how urgent the pattern is
 * @param description human-readable explanation
 * @param agents      agents whose data contributed
 * @param evidence    numbers backing the finding
 */
public record Finding(String type, IssueSeverity severity, String description, List<String> agents,
                      Map<String, Object> evidence) {

    public Finding {
        agents = agents != null ? List.copyOf(agents) : List.of();
        evidence = evidence != null ? evidence : Map.of();
    }
}
