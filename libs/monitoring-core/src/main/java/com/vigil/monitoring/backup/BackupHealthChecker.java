package com.vigil.monitoring.backup;

import com.vigil.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Inspects the backup directory and the host filesystem.
 * <p>
 * Per backup type the newest matching file decides: none found, smaller than 1 KB or older than
 * 48h is critical, older than 25h a warning. Root usage above 90% is critical, above 80% a
 * warning. No method throws; unreadable state is reported as CRITICAL (or −1 for directory sizes).
 */
public final class BackupHealthChecker {

    private static final Logger log = LoggerFactory.getLogger(BackupHealthChecker.class);

    static final long MIN_SIZE_BYTES = 1024;
    static final Duration CRITICAL_AGE = Duration.ofHours(48);
    static final Duration WARNING_AGE = Duration.ofHours(25);
    static final double DISK_CRITICAL_PERCENT = 90.0;
    static final double DISK_WARNING_PERCENT = 80.0;

    private final Path backupDirectory;
    private final List<BackupTarget> targets;
    private final Path diskRoot;
    private final List<Path> trackedDirectories;
    private final Clock clock;

    public BackupHealthChecker(Path backupDirectory, List<BackupTarget> targets, Path diskRoot,
                               List<Path> trackedDirectories, Clock clock) {
        if (backupDirectory == null) {
            throw new IllegalArgumentException("backupDirectory must not be null");
        }
        this.backupDirectory = backupDirectory;
        this.targets = List.copyOf(targets);
        this.diskRoot = diskRoot;
        this.trackedDirectories = List.copyOf(trackedDirectories);
        this.clock = clock;
    }

    /**
     * One {@link BackupCheck} per configured target, in configuration order.
     */
    public List<BackupCheck> checkBackupRecency() {
        boolean directoryExists = Files.isDirectory(backupDirectory);
        List<Path> files = directoryExists ? listFiles() : List.of();
        List<BackupCheck> checks = new ArrayList<>();
        for (BackupTarget target : targets) {
            if (target.cloudManaged()) {
                checks.add(new BackupCheck(target.type(), HealthStatus.HEALTHY, null, null, null,
                        "Cloud-managed backups, no local file expected"));
            } else if (!directoryExists) {
                checks.add(new BackupCheck(target.type(), HealthStatus.CRITICAL, null, null, null,
                        "Backup directory not found: " + backupDirectory));
            } else {
                checks.add(checkTarget(target, files));
            }
        }
        return checks;
    }

    /**
     * Root filesystem usage plus the size of each tracked directory.
     */
    public DiskUsage checkDiskSpace() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        for (Path directory : trackedDirectories) {
            sizes.put(directory.toString(), directorySizeMb(directory));
        }
        try {
            FileStore store = Files.getFileStore(diskRoot);
            long total = store.getTotalSpace();
            long usable = store.getUsableSpace();
            double used = total > 0 ? Math.round((double) (total - usable) / total * 1000.0) / 10.0 : 0.0;
            return new DiskUsage(classifyDisk(used), used, sizes, null);
        } catch (IOException | RuntimeException e) {
            log.error("Could not read disk usage of {}: {}", diskRoot, e.getMessage());
            return new DiskUsage(HealthStatus.CRITICAL, -1, sizes, e.getMessage());
        }
    }

    /**
     * Runs both checks and combines them: any critical part makes the result critical, a disk
     * warning lifts a healthy result to warning.
     */
    public BackupHealthReport runHealthCheck() {
        List<BackupCheck> backups = checkBackupRecency();
        DiskUsage disk = checkDiskSpace();
        HealthStatus overall = HealthStatus.worstOf(backups.stream().map(BackupCheck::status).toList());
        overall = HealthStatus.worst(overall, disk.status());
        return new BackupHealthReport(clock.instant(), backups, disk, overall);
    }

    static HealthStatus classifyDisk(double usedPercent) {
        if (usedPercent > DISK_CRITICAL_PERCENT) {
            return HealthStatus.CRITICAL;
        }
        return usedPercent > DISK_WARNING_PERCENT ? HealthStatus.WARNING : HealthStatus.HEALTHY;
    }

    private BackupCheck checkTarget(BackupTarget target, List<Path> files) {
        Optional<Path> newest = files.stream()
                .filter(file -> target.filePattern().matcher(file.getFileName().toString()).find())
                .max(Comparator.comparing(BackupHealthChecker::lastModified));
        if (newest.isEmpty()) {
            return new BackupCheck(target.type(), HealthStatus.CRITICAL, null, null, null,
                    "No " + target.type() + " backup found");
        }
        Path file = newest.get();
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            Duration age = Duration.between(attributes.lastModifiedTime().toInstant(), clock.instant());
            double ageHours = Math.round(age.toMinutes() / 6.0) / 10.0;
            double sizeMb = Math.round(attributes.size() / 1048.576) / 1000.0;
            String name = file.getFileName().toString();

            if (attributes.size() < MIN_SIZE_BYTES) {
                return new BackupCheck(target.type(), HealthStatus.CRITICAL, name, ageHours, sizeMb,
                        "Backup smaller than 1 KB, probably empty or corrupt");
            }
            if (age.compareTo(CRITICAL_AGE) > 0) {
                return new BackupCheck(target.type(), HealthStatus.CRITICAL, name, ageHours, sizeMb,
                        "Latest backup is " + ageHours + "h old");
            }
            if (age.compareTo(WARNING_AGE) > 0) {
                return new BackupCheck(target.type(), HealthStatus.WARNING, name, ageHours, sizeMb,
                        "Latest backup is " + ageHours + "h old");
            }
            return new BackupCheck(target.type(), HealthStatus.HEALTHY, name, ageHours, sizeMb, null);
        } catch (IOException e) {
            return new BackupCheck(target.type(), HealthStatus.CRITICAL, file.getFileName().toString(), null, null,
                    "Cannot read backup file: " + e.getMessage());
        }
    }

    private List<Path> listFiles() {
        try (Stream<Path> entries = Files.list(backupDirectory)) {
            return entries.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            log.error("Cannot list backup directory {}: {}", backupDirectory, e.getMessage());
            return List.of();
        }
    }

    private static Instant lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            return Instant.EPOCH;
        }
    }

    static long directorySizeMb(Path directory) {
        if (!Files.isDirectory(directory)) {
            return -1;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            long bytes = walk.filter(Files::isRegularFile).mapToLong(file -> {
                try {
                    return Files.size(file);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }).sum();
            return bytes / (1024 * 1024);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot size directory {}: {}", directory, e.getMessage());
            return -1;
        }
    }
}
