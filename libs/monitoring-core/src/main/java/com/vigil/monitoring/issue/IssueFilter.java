package com.vigil.monitoring.issue;

/**
 * Optional criteria for listing open issues; null fields match everything.
 */
public record IssueFilter(String agentName, IssueSeverity severity, String category, String destinationId) {

    public static IssueFilter none() {
        return new IssueFilter(null, null, null, null);
    }

    public boolean matches(AgentIssue issue) {
        return (agentName == null || agentName.equals(issue.agentName()))
                && (severity == null || severity == issue.severity())
                && (category == null || category.equals(issue.category()))
                && (destinationId == null || destinationId.equals(issue.destinationId()));
    }
}
