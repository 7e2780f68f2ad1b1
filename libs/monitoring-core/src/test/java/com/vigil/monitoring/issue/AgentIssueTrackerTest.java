package com.vigil.monitoring.issue;

import com.vigil.monitoring.testing.InMemoryIssueStore;
import com.vigil.monitoring.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AgentIssueTracker")
class AgentIssueTrackerTest {

    private MutableClock clock;
    private InMemoryIssueStore store;
    private List<Boolean> creations;
    private AgentIssueTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-05T08:30:00Z"));
        store = new InMemoryIssueStore();
        creations = new ArrayList<>();
        tracker = new AgentIssueTracker(store, clock, (issue, created) -> creations.add(created));
    }

    private AgentIssue raise(String fingerprint, IssueSeverity severity) {
        return tracker.raiseIssue("anomaly-detection", fingerprint, severity, "anomaly",
                "Anomaly in " + fingerprint, "value out of range", Map.of("value", 42), null);
    }

    @Nested
    @DisplayName("raiseIssue")
    class Raise {

        @Test
        @DisplayName("should open a new issue with a dated sequential id")
        void shouldOpenIssue() {
            AgentIssue first = raise("anomaly:a:x", IssueSeverity.HIGH);
            AgentIssue second = raise("anomaly:a:y", IssueSeverity.MEDIUM);

            assertThat(first.issueId()).isEqualTo("ISSUE-20260305-001");
            assertThat(second.issueId()).isEqualTo("ISSUE-20260305-002");
            assertThat(first.status()).isEqualTo(IssueStatus.OPEN);
            assertThat(first.occurrenceCount()).isEqualTo(1);
            assertThat(first.slaTarget()).isEqualTo(clock.instant().plus(Duration.ofHours(72)));
            assertThat(creations).containsExactly(true, true);
        }

        @Test
        @DisplayName("should restart the sequence on a new UTC day")
        void shouldRestartSequenceDaily() {
            raise("anomaly:a:x", IssueSeverity.LOW);
            clock.advance(Duration.ofDays(1));

            assertThat(raise("anomaly:a:y", IssueSeverity.LOW).issueId()).isEqualTo("ISSUE-20260306-001");
        }

        @Test
        @DisplayName("should deduplicate by fingerprint while the issue is active")
        void shouldDeduplicate() {
            AgentIssue first = raise("anomaly:a:x", IssueSeverity.HIGH);
            clock.advance(Duration.ofHours(1));
            AgentIssue again = tracker.raiseIssue("anomaly-detection", "anomaly:a:x", IssueSeverity.HIGH,
                    "anomaly", "Anomaly", "still out of range", Map.of("value", 50), null);

            assertThat(again.issueId()).isEqualTo(first.issueId());
            assertThat(again.occurrenceCount()).isEqualTo(2);
            assertThat(again.lastSeenAt()).isEqualTo(clock.instant());
            assertThat(again.details()).containsEntry("value", 50);
            assertThat(store.findAll()).hasSize(1);
            assertThat(creations).containsExactly(true, false);
        }

        @Test
        @DisplayName("should escalate severity, title and SLA on a more severe recurrence")
        void shouldEscalate() {
            AgentIssue first = raise("health:storage:mongodb", IssueSeverity.MEDIUM);
            clock.advance(Duration.ofHours(2));

            AgentIssue again = tracker.raiseIssue("anomaly-detection", "health:storage:mongodb",
                    IssueSeverity.CRITICAL, "anomaly", "mongodb is CRITICAL", "no primary", Map.of(), null);

            assertThat(again.issueId()).isEqualTo(first.issueId());
            assertThat(again.severity()).isEqualTo(IssueSeverity.CRITICAL);
            assertThat(again.title()).isEqualTo("mongodb is CRITICAL");
            assertThat(again.description()).isEqualTo("no primary");
            assertThat(again.slaTarget()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
            assertThat(again.detectedAt()).isEqualTo(first.detectedAt());
        }

        @Test
        @DisplayName("should keep the worse severity when a recurrence is milder")
        void shouldNotDowngrade() {
            AgentIssue first = raise("health:storage:mongodb", IssueSeverity.CRITICAL);
            clock.advance(Duration.ofHours(2));

            AgentIssue again = tracker.raiseIssue("anomaly-detection", "health:storage:mongodb",
                    IssueSeverity.MEDIUM, "anomaly", "mongodb is WARNING", "slow", Map.of(), null);

            assertThat(again.severity()).isEqualTo(IssueSeverity.CRITICAL);
            assertThat(again.title()).isEqualTo(first.title());
            assertThat(again.slaTarget()).isEqualTo(first.slaTarget());
            assertThat(again.occurrenceCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should open a fresh issue once the previous one is terminal")
        void shouldReopenAfterResolution() {
            AgentIssue first = raise("anomaly:a:x", IssueSeverity.HIGH);
            tracker.resolve(first.issueId(), "fixed");

            AgentIssue second = raise("anomaly:a:x", IssueSeverity.HIGH);

            assertThat(second.issueId()).isNotEqualTo(first.issueId());
            assertThat(second.occurrenceCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should leave INFO issues without an SLA")
        void shouldHaveNoSlaForInfo() {
            assertThat(raise("info:x", IssueSeverity.INFO).slaTarget()).isNull();
        }
    }

    @Nested
    @DisplayName("autoCloseIssues")
    class AutoClose {

        @Test
        @DisplayName("should close only issues absent from the active set")
        void shouldCloseAbsent() {
            AgentIssue stillActive = raise("anomaly:a:x", IssueSeverity.HIGH);
            AgentIssue gone = raise("anomaly:a:y", IssueSeverity.HIGH);

            List<AgentIssue> closed = tracker.autoCloseIssues("anomaly-detection", "anomaly", Set.of("anomaly:a:x"));

            assertThat(closed).extracting(AgentIssue::issueId).containsExactly(gone.issueId());
            assertThat(tracker.getIssue(gone.issueId()).status()).isEqualTo(IssueStatus.AUTO_CLOSED);
            assertThat(tracker.getIssue(gone.issueId()).resolvedAt()).isEqualTo(clock.instant());
            assertThat(tracker.getIssue(stillActive.issueId()).status()).isEqualTo(IssueStatus.OPEN);
        }

        @Test
        @DisplayName("should not touch other agents, other categories or in-progress issues")
        void shouldRespectScope() {
            AgentIssue otherAgent = tracker.raiseIssue("security-reviewer", "sec:1", IssueSeverity.HIGH, "anomaly",
                    "t", "d", Map.of(), null);
            AgentIssue otherCategory = tracker.raiseIssue("anomaly-detection", "perf:1", IssueSeverity.HIGH, "perf",
                    "t", "d", Map.of(), null);
            AgentIssue inProgress = raise("anomaly:a:z", IssueSeverity.HIGH);
            tracker.startProgress(inProgress.issueId());

            List<AgentIssue> closed = tracker.autoCloseIssues("anomaly-detection", "anomaly", Set.of());

            assertThat(closed).isEmpty();
            assertThat(tracker.getIssue(otherAgent.issueId()).status()).isEqualTo(IssueStatus.OPEN);
            assertThat(tracker.getIssue(otherCategory.issueId()).status()).isEqualTo(IssueStatus.OPEN);
            assertThat(tracker.getIssue(inProgress.issueId()).status()).isEqualTo(IssueStatus.IN_PROGRESS);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should walk open, acknowledged, in progress, resolved")
        void shouldWalkHappyPath() {
            String id = raise("anomaly:a:x", IssueSeverity.MEDIUM).issueId();

            clock.advance(Duration.ofMinutes(10));
            AgentIssue acknowledged = tracker.acknowledge(id);
            tracker.startProgress(id);
            AgentIssue resolved = tracker.resolve(id, "restarted worker");

            assertThat(acknowledged.acknowledgedAt()).isEqualTo(clock.instant());
            assertThat(resolved.status()).isEqualTo(IssueStatus.RESOLVED);
            assertThat(resolved.resolution()).isEqualTo("restarted worker");
            assertThat(resolved.acknowledgedAt()).isEqualTo(acknowledged.acknowledgedAt());
        }

        @Test
        @DisplayName("should reject leaving a terminal state")
        void shouldRejectFromTerminal() {
            String id = raise("anomaly:a:x", IssueSeverity.MEDIUM).issueId();
            tracker.markWontFix(id, "expected seasonal dip");

            assertThatThrownBy(() -> tracker.acknowledge(id))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("wont_fix");
        }

        @Test
        @DisplayName("should reject acknowledging an in-progress issue")
        void shouldRejectBackwards() {
            String id = raise("anomaly:a:x", IssueSeverity.MEDIUM).issueId();
            tracker.startProgress(id);

            assertThatThrownBy(() -> tracker.acknowledge(id)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should throw IssueNotFoundException for an unknown id")
        void shouldThrowForUnknown() {
            assertThatThrownBy(() -> tracker.resolve("ISSUE-19990101-001", "x"))
                    .isInstanceOf(IssueNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should order open issues by severity then most recently seen")
        void shouldOrderOpenIssues() {
            AgentIssue medium = raise("m", IssueSeverity.MEDIUM);
            clock.advance(Duration.ofMinutes(1));
            AgentIssue criticalOld = raise("c1", IssueSeverity.CRITICAL);
            clock.advance(Duration.ofMinutes(1));
            AgentIssue criticalNew = raise("c2", IssueSeverity.CRITICAL);

            assertThat(tracker.getOpenIssues(IssueFilter.none())).extracting(AgentIssue::issueId)
                    .containsExactly(criticalNew.issueId(), criticalOld.issueId(), medium.issueId());
            assertThat(tracker.getOpenIssues(new IssueFilter(null, IssueSeverity.MEDIUM, null, null)))
                    .extracting(AgentIssue::issueId).containsExactly(medium.issueId());
        }

        @Test
        @DisplayName("should report SLA breaches and stats")
        void shouldReportBreaches() {
            AgentIssue critical = raise("c", IssueSeverity.CRITICAL);
            raise("l", IssueSeverity.LOW);
            AgentIssue resolved = raise("r", IssueSeverity.CRITICAL);
            tracker.resolve(resolved.issueId(), "done");

            clock.advance(Duration.ofHours(25));

            assertThat(tracker.getSLABreaches()).extracting(AgentIssue::issueId).containsExactly(critical.issueId());
            IssueStats stats = tracker.getStats();
            assertThat(stats.active()).isEqualTo(2);
            assertThat(stats.slaBreaches()).isEqualTo(1);
            assertThat(stats.byStatus()).containsEntry(IssueStatus.OPEN, 2L).containsEntry(IssueStatus.RESOLVED, 1L);
            assertThat(stats.activeBySeverity()).containsEntry(IssueSeverity.CRITICAL, 1L)
                    .containsEntry(IssueSeverity.LOW, 1L);
        }
    }
}
