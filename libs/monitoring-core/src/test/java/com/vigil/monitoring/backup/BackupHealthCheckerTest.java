package com.vigil.monitoring.backup;

import com.vigil.monitoring.testing.MutableClock;
import com.vigil.observability.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackupHealthChecker")
class BackupHealthCheckerTest {

    @TempDir
    Path backups;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-15T12:00:00Z"));
    }

    private BackupHealthChecker checker(List<BackupTarget> targets) {
        return new BackupHealthChecker(backups, targets, backups, List.of(backups), clock);
    }

    private Path backup(String name, int bytes, Duration age) throws IOException {
        Path file = backups.resolve(name);
        Files.write(file, new byte[bytes]);
        Files.setLastModifiedTime(file, FileTime.from(clock.instant().minus(age)));
        return file;
    }

    @Nested
    @DisplayName("Backup recency")
    class Recency {

        @Test
        @DisplayName("should be HEALTHY for a recent backup")
        void shouldBeHealthy() throws IOException {
            backup("postgres-2026-06-15.sql.gz", 4096, Duration.ofHours(10));

            BackupCheck check = checker(List.of(BackupTarget.sqlDumps("postgres"))).checkBackupRecency().get(0);

            assertThat(check.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(check.latestFile()).isEqualTo("postgres-2026-06-15.sql.gz");
            assertThat(check.ageHours()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("should warn for a backup older than 25 hours")
        void shouldWarn() throws IOException {
            backup("postgres.sql", 4096, Duration.ofHours(30));

            assertThat(checker(List.of(BackupTarget.sqlDumps("postgres"))).checkBackupRecency().get(0).status())
                    .isEqualTo(HealthStatus.WARNING);
        }

        @Test
        @DisplayName("should be CRITICAL for a backup older than 48 hours")
        void shouldBeCriticalWhenOld() throws IOException {
            backup("postgres.sql", 4096, Duration.ofHours(50));

            BackupCheck check = checker(List.of(BackupTarget.sqlDumps("postgres"))).checkBackupRecency().get(0);

            assertThat(check.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(check.message()).isEqualTo("Latest backup is 50.0h old");
        }

        @Test
        @DisplayName("should pick the newest matching file")
        void shouldPickNewest() throws IOException {
            backup("postgres-old.sql", 4096, Duration.ofHours(60));
            backup("postgres-new.sql", 4096, Duration.ofHours(2));
            backup("notes.txt", 4096, Duration.ofMinutes(1));

            BackupCheck check = checker(List.of(BackupTarget.sqlDumps("postgres"))).checkBackupRecency().get(0);

            assertThat(check.latestFile()).isEqualTo("postgres-new.sql");
        }

        @Test
        @DisplayName("should be CRITICAL for a file smaller than 1 KB")
        void shouldRejectTinyFile() throws IOException {
            backup("mongo-2026-06-15.archive", 100, Duration.ofHours(1));

            BackupCheck check = checker(List.of(BackupTarget.mongoArchives("mongodb", "mongodb://db:27017")))
                    .checkBackupRecency().get(0);

            assertThat(check.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(check.message()).contains("smaller than 1 KB");
        }

        @Test
        @DisplayName("should be CRITICAL when no matching file exists")
        void shouldReportMissingBackup() {
            BackupCheck check = checker(List.of(BackupTarget.sqlDumps("postgres"))).checkBackupRecency().get(0);

            assertThat(check.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(check.latestFile()).isNull();
        }

        @Test
        @DisplayName("should treat Atlas connection strings as cloud-managed")
        void shouldSkipAtlas() {
            BackupCheck check = checker(List.of(BackupTarget.mongoArchives("mongodb",
                    "mongodb+srv://user@cluster0.abc.mongodb.net/app"))).checkBackupRecency().get(0);

            assertThat(check.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(check.message()).contains("Cloud-managed");
        }

        @Test
        @DisplayName("should mark every local target CRITICAL when the directory is missing")
        void shouldHandleMissingDirectory() {
            BackupHealthChecker missing = new BackupHealthChecker(backups.resolve("absent"),
                    List.of(BackupTarget.sqlDumps("postgres"), BackupTarget.mongoArchives("mongodb", null)),
                    backups, List.of(), clock);

            assertThat(missing.checkBackupRecency())
                    .allSatisfy(check -> {
                        assertThat(check.status()).isEqualTo(HealthStatus.CRITICAL);
                        assertThat(check.message()).startsWith("Backup directory not found");
                    })
                    .hasSize(2);
        }
    }

    @Nested
    @DisplayName("Disk")
    class Disk {

        @Test
        @DisplayName("should classify usage thresholds")
        void shouldClassify() {
            assertThat(BackupHealthChecker.classifyDisk(95)).isEqualTo(HealthStatus.CRITICAL);
            assertThat(BackupHealthChecker.classifyDisk(85)).isEqualTo(HealthStatus.WARNING);
            assertThat(BackupHealthChecker.classifyDisk(80)).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should read usage of an existing filesystem")
        void shouldReadUsage() {
            DiskUsage usage = checker(List.of()).checkDiskSpace();

            assertThat(usage.usedPercent()).isBetween(0.0, 100.0);
            assertThat(usage.error()).isNull();
            assertThat(usage.directorySizesMb()).containsKey(backups.toString());
        }

        @Test
        @DisplayName("should report CRITICAL with -1 when usage cannot be read")
        void shouldReportUnreadableDisk() {
            BackupHealthChecker broken = new BackupHealthChecker(backups, List.of(), backups.resolve("nope"),
                    List.of(backups.resolve("nope")), clock);

            DiskUsage usage = broken.checkDiskSpace();

            assertThat(usage.status()).isEqualTo(HealthStatus.CRITICAL);
            assertThat(usage.usedPercent()).isEqualTo(-1.0);
            assertThat(usage.directorySizesMb()).containsValue(-1L);
        }

        @Test
        @DisplayName("should size directories in whole megabytes")
        void shouldSizeDirectories() throws IOException {
            backup("big.sql", 3 * 1024 * 1024, Duration.ZERO);

            assertThat(BackupHealthChecker.directorySizeMb(backups)).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("should combine the worst of backups and disk")
    void shouldCombine() throws IOException {
        backup("postgres.sql", 4096, Duration.ofHours(30));
        BackupHealthChecker unreadableDisk = new BackupHealthChecker(backups, List.of(BackupTarget.sqlDumps("postgres")),
                backups.resolve("nope"), List.of(), clock);

        BackupHealthReport report = unreadableDisk.runHealthCheck();

        assertThat(report.backups().get(0).status()).isEqualTo(HealthStatus.WARNING);
        assertThat(report.overall()).isEqualTo(HealthStatus.CRITICAL);
    }
}
