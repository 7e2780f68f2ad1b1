package com.vigil.monitoring.backup;

import java.util.regex.Pattern;

/**
 * A kind of backup to look for in the backup directory.
 *
 * @param type         backup type, e.g. {@code relational} or {@code document}
 * @param filePattern  pattern a backup file name must match
 * @param cloudManaged true when backups are taken by a managed service and no local file is expected
 */
public record BackupTarget(String type, Pattern filePattern, boolean cloudManaged) {

    public BackupTarget {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (filePattern == null && !cloudManaged) {
            throw new IllegalArgumentException("filePattern must not be null for local backups");
        }
    }

    /** SQL dumps: {@code *.sql} and {@code *.sql.gz}. */
    public static BackupTarget sqlDumps(String type) {
        return new BackupTarget(type, Pattern.compile("\\.(sql|sql\\.gz)$"), false);
    }

    /**
     * MongoDB archives ({@code mongo*.gz}, {@code mongo*.tar.gz}, {@code mongo*.archive}). A
     * connection string pointing at Atlas ({@code mongodb+srv} or {@code mongodb.net}) means the
     * backups are cloud-managed.
     */
    public static BackupTarget mongoArchives(String type, String connectionString) {
        boolean atlas = connectionString != null
                && (connectionString.startsWith("mongodb+srv") || connectionString.contains("mongodb.net"));
        return new BackupTarget(type, Pattern.compile("^mongo.*\\.(gz|tar\\.gz|archive)$"), atlas);
    }
}
