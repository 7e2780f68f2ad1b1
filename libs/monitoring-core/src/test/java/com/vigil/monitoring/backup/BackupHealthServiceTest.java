package com.vigil.monitoring.backup;

import com.vigil.monitoring.alert.AlertDispatcher;
import com.vigil.monitoring.alert.AlertPolicy;
import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.testing.InMemoryHistoryStore;
import com.vigil.monitoring.testing.MutableClock;
import com.vigil.monitoring.testing.RecordingNotifier;
import com.vigil.observability.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackupHealthService")
class BackupHealthServiceTest {

    @TempDir
    Path root;

    private MutableClock clock;
    private InMemoryHistoryStore history;
    private RecordingNotifier notifier;
    private BackupHealthService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-15T12:00:00Z"));
        history = new InMemoryHistoryStore();
        notifier = new RecordingNotifier();
        BackupHealthChecker checker = new BackupHealthChecker(root.resolve("backups"),
                List.of(BackupTarget.sqlDumps("postgres")), root, List.of(), clock);
        service = new BackupHealthService(checker, history,
                new AlertDispatcher(notifier, AlertPolicy.defaults(), clock));
    }

    @Test
    @DisplayName("should persist the report and alert once with urgency 4 when critical")
    @SuppressWarnings("unchecked")
    void shouldPersistAndAlert() {
        BackupHealthReport report = service.run();
        service.run();

        assertThat(report.overall()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(notifier.sent()).singleElement().satisfies(notification -> {
            assertThat(notification.urgency()).isEqualTo(4);
            assertThat(notification.message()).contains("postgres: Backup directory not found");
        });
        HistoryEntry latest = service.getLatestCheck().orElseThrow();
        assertThat(latest.status()).isEqualTo("critical");
        assertThat((Map<String, Object>) latest.metrics().get("backups")).containsKey("postgres");
        assertThat(history.all()).hasSize(2);
    }

    @Test
    @DisplayName("should still alert when history cannot be written")
    void shouldAlertWithoutHistory() {
        history.setFailing(true);

        service.run();

        assertThat(notifier.sent()).hasSize(1);
        assertThat(service.getLatestCheck()).isEmpty();
    }
}
