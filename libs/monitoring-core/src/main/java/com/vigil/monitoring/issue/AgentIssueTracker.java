package com.vigil.monitoring.issue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Raises, deduplicates and moves issues through their lifecycle.
 * <p>
 * Writes are serialized on this instance so that at most one non-terminal issue exists per
 * fingerprint and daily sequence numbers are not handed out twice.
 */
public final class AgentIssueTracker {

    private static final Logger log = LoggerFactory.getLogger(AgentIssueTracker.class);

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private static final Comparator<AgentIssue> BY_SEVERITY_THEN_RECENCY = Comparator
            .comparing(AgentIssue::severity)
            .thenComparing(AgentIssue::lastSeenAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final IssueStore store;
    private final Clock clock;
    private final BiConsumer<AgentIssue, Boolean> listener;

    public AgentIssueTracker(IssueStore store, Clock clock) {
        this(store, clock, (issue, created) -> {
        });
    }

    /**
     * @param listener called after every raise with the issue and whether it was newly created
     */
    public AgentIssueTracker(IssueStore store, Clock clock, BiConsumer<AgentIssue, Boolean> listener) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Records a detection. If a non-terminal issue with the same fingerprint exists its occurrence
     * count and details are refreshed, and a more severe detection escalates it; otherwise a new issue {@code ISSUE-YYYYMMDD-NNN} is opened.
     */
    public synchronized AgentIssue raiseIssue(String agentName, String fingerprint, IssueSeverity severity,
                                              String category, String title, String description,
                                              Map<String, Object> details, String destinationId) {
        Instant now = clock.instant();
        AgentIssue existing = store.findActiveByFingerprint(fingerprint).orElse(null);
        if (existing != null) {
            AgentIssue updated = store.save(existing.recurred(severity, title, description, details, now));
            if (updated.severity() != existing.severity()) {
                log.info("Escalated issue {} from {} to {}", updated.issueId(), existing.severity().key(),
                        updated.severity().key());
            } else {
                log.debug("Issue {} seen again ({} occurrences)", updated.issueId(), updated.occurrenceCount());
            }
            notifyListener(updated, false);
            return updated;
        }

        AgentIssue issue = new AgentIssue(nextIssueId(now), agentName, severity, category, title, description,
                details, IssueStatus.OPEN, now, null, null, null, fingerprint, 1, now,
                severity.slaTarget(now), destinationId);
        AgentIssue saved = store.save(issue);
        log.info("Raised {} issue {} [{}]: {}", severity.key(), saved.issueId(), fingerprint, title);
        notifyListener(saved, true);
        return saved;
    }

    /**
     * Auto-closes open or acknowledged issues of {@code agentName} in {@code category} whose
     * fingerprint is not in {@code activeFingerprints}. In-progress issues are left for a human.
     *
     * @return the issues that were closed
     */
    public synchronized List<AgentIssue> autoCloseIssues(String agentName, String category,
                                                         Set<String> activeFingerprints) {
        Instant now = clock.instant();
        List<AgentIssue> closed = store.findActive().stream()
                .filter(issue -> agentName.equals(issue.agentName()))
                .filter(issue -> category == null || category.equals(issue.category()))
                .filter(issue -> !activeFingerprints.contains(issue.fingerprint()))
                .filter(issue -> issue.status().canTransitionTo(IssueStatus.AUTO_CLOSED))
                .map(issue -> store.save(issue.transitioned(IssueStatus.AUTO_CLOSED, now,
                        "Auto-closed: condition no longer detected")))
                .toList();
        if (!closed.isEmpty()) {
            log.info("Auto-closed {} {} issues for {}", closed.size(), category, agentName);
        }
        return closed;
    }

    public AgentIssue acknowledge(String issueId) {
        return transition(issueId, IssueStatus.ACKNOWLEDGED, null);
    }

    public AgentIssue startProgress(String issueId) {
        return transition(issueId, IssueStatus.IN_PROGRESS, null);
    }

    public AgentIssue resolve(String issueId, String resolution) {
        return transition(issueId, IssueStatus.RESOLVED, resolution);
    }

    public AgentIssue markWontFix(String issueId, String reason) {
        return transition(issueId, IssueStatus.WONT_FIX, reason);
    }

    /**
     * @throws IssueNotFoundException if the id is unknown
     */
    public AgentIssue getIssue(String issueId) {
        return store.findById(issueId).orElseThrow(() -> new IssueNotFoundException(issueId));
    }

    /**
     * Non-terminal issues matching the filter, most severe first, then most recently seen.
     */
    public List<AgentIssue> getOpenIssues(IssueFilter filter) {
        IssueFilter effective = filter != null ? filter : IssueFilter.none();
        return store.findActive().stream()
                .filter(effective::matches)
                .sorted(BY_SEVERITY_THEN_RECENCY)
                .toList();
    }

    /**
     * Non-terminal issues whose SLA target has passed.
     */
    public List<AgentIssue> getSLABreaches() {
        Instant now = clock.instant();
        return store.findActive().stream()
                .filter(issue -> issue.isSlaBreached(now))
                .sorted(Comparator.comparing(AgentIssue::slaTarget))
                .toList();
    }

    public IssueStats getStats() {
        Instant now = clock.instant();
        Map<IssueStatus, Long> byStatus = new EnumMap<>(IssueStatus.class);
        Map<IssueSeverity, Long> bySeverity = new EnumMap<>(IssueSeverity.class);
        long active = 0;
        long breaches = 0;
        for (AgentIssue issue : store.findAll()) {
            byStatus.merge(issue.status(), 1L, Long::sum);
            if (!issue.status().isTerminal()) {
                active++;
                bySeverity.merge(issue.severity(), 1L, Long::sum);
                if (issue.isSlaBreached(now)) {
                    breaches++;
                }
            }
        }
        return new IssueStats(byStatus, bySeverity, active, breaches);
    }

    private synchronized AgentIssue transition(String issueId, IssueStatus target, String resolution) {
        AgentIssue issue = getIssue(issueId);
        if (!issue.status().canTransitionTo(target)) {
            throw new IllegalStateException("Issue " + issueId + " cannot move from "
                    + issue.status().key() + " to " + target.key());
        }
        AgentIssue updated = store.save(issue.transitioned(target, clock.instant(), resolution));
        log.info("Issue {} moved {} -> {}", issueId, issue.status().key(), target.key());
        return updated;
    }

    private String nextIssueId(Instant now) {
        String prefix = "ISSUE-" + ID_DATE.format(now) + "-";
        int sequence = store.countByIdPrefix(prefix) + 1;
        return prefix + String.format("%03d", sequence);
    }

    private void notifyListener(AgentIssue issue, boolean created) {
        try {
            listener.accept(issue, created);
        } catch (RuntimeException e) {
            log.warn("Issue listener failed for {}: {}", issue.issueId(), e.getMessage());
        }
    }
}
