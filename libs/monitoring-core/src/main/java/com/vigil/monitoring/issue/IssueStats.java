package com.vigil.monitoring.issue;

import java.util.Map;

/**
 * Dashboard counts. {@code activeBySeverity} only counts non-terminal issues.
 */
public record IssueStats(Map<IssueStatus, Long> byStatus, Map<IssueSeverity, Long> activeBySeverity,
                         long active, long slaBreaches) {
}
