package com.vigil.healthmonitor.api;

import com.vigil.database.migration.MigrationService;
import com.vigil.monitoring.backup.BackupHealthService;
import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.smoke.SmokeTestRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Latest persisted results for the dashboard, plus the schema state of the monitoring database.
 */
@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private final SmokeTestRunner smokeTests;
    private final BackupHealthService backups;
    private final ObjectProvider<MigrationService> migrations;

    public ReportController(
            SmokeTestRunner smokeTests,
            BackupHealthService backups,
            ObjectProvider<MigrationService> migrations) {
        this.smokeTests = smokeTests;
        this.backups = backups;
        this.migrations = migrations;
    }

    @GetMapping("/smoke-tests/latest")
    public ResponseEntity<HistoryEntry> latestSmokeTests() {
        return ResponseEntity.of(smokeTests.getLatestResult());
    }

    @GetMapping("/backups/latest")
    public ResponseEntity<HistoryEntry> latestBackupCheck() {
        return ResponseEntity.of(backups.getLatestCheck());
    }

    /** 404 when migrations are managed outside this service. */
    @GetMapping("/migrations")
    public ResponseEntity<MigrationService.DatabaseStatus> migrations() {
        MigrationService service = migrations.getIfAvailable();
        return service != null ? ResponseEntity.ok(service.status()) : ResponseEntity.notFound().build();
    }
}
