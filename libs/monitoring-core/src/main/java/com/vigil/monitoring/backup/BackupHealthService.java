package com.vigil.monitoring.backup;

import com.vigil.monitoring.alert.AlertDispatcher;
import com.vigil.monitoring.alert.AlertRequest;
import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the backup checker, records the result in history and alerts on CRITICAL.
 */
public final class BackupHealthService {

    private static final Logger log = LoggerFactory.getLogger(BackupHealthService.class);

    public static final String AGENT_NAME = "backup-health";
    public static final String ACTION = "backup_health_check";
    static final int CRITICAL_URGENCY = 4;

    private final BackupHealthChecker checker;
    private final HistoryStore history;
    private final AlertDispatcher dispatcher;

    public BackupHealthService(BackupHealthChecker checker, HistoryStore history, AlertDispatcher dispatcher) {
        this.checker = checker;
        this.history = history;
        this.dispatcher = dispatcher;
    }

    public BackupHealthReport run() {
        BackupHealthReport report = checker.runHealthCheck();
        try {
            history.append(HistoryEntry.of(AGENT_NAME, ACTION, report.timestamp(),
                    report.overall().name().toLowerCase(Locale.ROOT), "Backup health " + report.overall(),
                    toMetrics(report)));
        } catch (RuntimeException e) {
            log.warn("Could not persist backup health check: {}", e.getMessage(), e);
        }

        if (report.overall() == HealthStatus.CRITICAL) {
            List<String> parts = new ArrayList<>();
            for (BackupCheck backup : report.backups()) {
                if (backup.status() == HealthStatus.CRITICAL) {
                    parts.add(backup.type() + ": " + backup.message());
                }
            }
            if (report.disk().status() == HealthStatus.CRITICAL) {
                parts.add(report.disk().usedPercent() < 0
                        ? "Disk: usage unknown (" + report.disk().error() + ")"
                        : "Disk: " + report.disk().usedPercent() + "% used");
            }
            dispatcher.dispatch(new AlertRequest("backups:overall:critical", CRITICAL_URGENCY,
                    "Backup health CRITICAL", String.join(". ", parts), "backups",
                    Map.of("criticalParts", parts.size())));
        } else {
            log.info("Backup health {}", report.overall());
        }
        return report;
    }

    /**
     * The most recent persisted backup check, if any.
     */
    public Optional<HistoryEntry> getLatestCheck() {
        return history.latest(AGENT_NAME, ACTION);
    }

    private static Map<String, Object> toMetrics(BackupHealthReport report) {
        Map<String, Object> backups = new LinkedHashMap<>();
        for (BackupCheck backup : report.backups()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", backup.status().name());
            entry.put("file", backup.latestFile());
            entry.put("ageHours", backup.ageHours());
            entry.put("sizeMb", backup.sizeMb());
            entry.put("message", backup.message());
            backups.put(backup.type(), entry);
        }
        Map<String, Object> disk = new LinkedHashMap<>();
        disk.put("status", report.disk().status().name());
        disk.put("usedPercent", report.disk().usedPercent());
        disk.put("directorySizesMb", report.disk().directorySizesMb());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("overall", report.overall().name());
        metrics.put("backups", backups);
        metrics.put("disk", disk);
        return metrics;
    }
}
