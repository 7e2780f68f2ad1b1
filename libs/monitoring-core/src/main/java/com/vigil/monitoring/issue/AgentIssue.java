package com.vigil.monitoring.issue;

import java.time.Instant;
import java.util.Map;

/**
 * A deduplicated, actionable finding raised by an agent.
 * <p>
 * At most one non-terminal issue exists per fingerprint; repeated detections increase
 * {@code occurrenceCount} instead of creating new issues.
 */
public record AgentIssue(
        String issueId,
        String agentName,
        IssueSeverity severity,
        String category,
        String title,
        String description,
        Map<String, Object> details,
        IssueStatus status,
        Instant detectedAt,
        Instant acknowledgedAt,
        Instant resolvedAt,
        String resolution,
        String fingerprint,
        int occurrenceCount,
        Instant lastSeenAt,
        Instant slaTarget,
        String destinationId
) {

    public AgentIssue {
        if (issueId == null || issueId.isBlank()) {
            throw new IllegalArgumentException("issueId must not be null or blank");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        details = details != null ? details : Map.of();
    }

    public boolean isSlaBreached(Instant now) {
        return !status.isTerminal() && slaTarget != null && slaTarget.isBefore(now);
    }

    /**
     * A repeat detection. A more severe detection escalates the issue: severity, title and
     * description are taken from it and the SLA deadline moves to the earlier of the two.
     */
    AgentIssue recurred(IssueSeverity newSeverity, String newTitle, String newDescription,
                        Map<String, Object> newDetails, Instant seenAt) {
        boolean escalated = newSeverity != null && newSeverity.compareTo(severity) < 0;
        IssueSeverity nextSeverity = escalated ? newSeverity : severity;
        String nextTitle = escalated && newTitle != null ? newTitle : title;
        String nextDescription = escalated && newDescription != null ? newDescription : description;
        Instant nextSla = slaTarget;
        if (escalated) {
            Instant escalatedSla = newSeverity.slaTarget(seenAt);
            if (nextSla == null || (escalatedSla != null && escalatedSla.isBefore(nextSla))) {
                nextSla = escalatedSla;
            }
        }
        return new AgentIssue(issueId, agentName, nextSeverity, category, nextTitle, nextDescription,
                newDetails != null ? newDetails : details, status, detectedAt, acknowledgedAt, resolvedAt,
                resolution, fingerprint, occurrenceCount + 1, seenAt, nextSla, destinationId);
    }

    AgentIssue transitioned(IssueStatus newStatus, Instant at, String newResolution) {
        Instant acknowledged = newStatus == IssueStatus.ACKNOWLEDGED && acknowledgedAt == null ? at : acknowledgedAt;
        Instant resolved = newStatus.isTerminal() ? at : resolvedAt;
        return new AgentIssue(issueId, agentName, severity, category, title, description, details, newStatus,
                detectedAt, acknowledged, resolved, newResolution != null ? newResolution : resolution,
                fingerprint, occurrenceCount, lastSeenAt, slaTarget, destinationId);
    }
}
