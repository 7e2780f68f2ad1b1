package com.vigil.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Read-only view of the monitoring schema's migration state.
 */
public class MigrationService {

    /**
     * One known migration.
     *
     * @param version     migration version, e.g. {@code 1}
     * @param description migration description, e.g. {@code monitoring schema}
     * @param state       Flyway state, e.g. {@code SUCCESS} or {@code PENDING}
     * @param installedOn ISO-8601 instant the migration was applied, null when pending
     */
    public record MigrationEntry(String version, String description, String state, String installedOn) {}

    /**
     * Migration summary of a database.
     *
     * @param database          logical database name
     * @param url               JDBC URL
     * @param appliedMigrations number of applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion    current schema version, null before the first migration
     * @param migrations        every known migration in version order
     */
    public record DatabaseStatus(
            String database,
            String url,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion,
            List<MigrationEntry> migrations) {}

    private final String database;
    private final String url;
    private final Flyway flyway;

    public MigrationService(String database, String url, Flyway flyway) {
        this.database = database;
        this.url = url;
        this.flyway = flyway;
    }

    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        List<MigrationEntry> entries =
                Arrays.stream(info.all())
                        .map(
                                migration ->
                                        new MigrationEntry(
                                                migration.getVersion() != null
                                                        ? migration.getVersion().getVersion()
                                                        : null,
                                                migration.getDescription(),
                                                migration.getState().name(),
                                                migration.getInstalledOn() != null
                                                        ? migration.getInstalledOn().toInstant().toString()
                                                        : null))
                        .toList();
        MigrationInfo current = info.current();
        return new DatabaseStatus(
                database,
                url,
                info.applied().length,
                info.pending().length,
                current != null && current.getVersion() != null ? current.getVersion().getVersion() : null,
                entries);
    }
}
