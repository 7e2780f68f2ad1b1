package com.vigil.monitoring.issue;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of {@link AgentIssue} records. Issues are never deleted.
 */
public interface IssueStore {

    Optional<AgentIssue> findById(String issueId);

    /** The non-terminal issue with this fingerprint, if any. */
    Optional<AgentIssue> findActiveByFingerprint(String fingerprint);

    /** All non-terminal issues. */
    List<AgentIssue> findActive();

    List<AgentIssue> findAll();

    /** Inserts or updates by issue id. */
    AgentIssue save(AgentIssue issue);

    /** Number of issues whose id starts with {@code prefix}, used for daily sequence numbers. */
    int countByIdPrefix(String prefix);
}
