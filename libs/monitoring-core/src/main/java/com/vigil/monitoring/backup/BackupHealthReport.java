package com.vigil.monitoring.backup;

import com.vigil.observability.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * Combined backup recency and disk verdict.
 */
public record BackupHealthReport(Instant timestamp, List<BackupCheck> backups, DiskUsage disk,
                                 HealthStatus overall) {

    public BackupHealthReport {
        backups = List.copyOf(backups);
    }
}
