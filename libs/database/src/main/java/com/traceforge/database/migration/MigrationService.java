package com.traceforge.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationState;

/**
 * Reports the migration state of a database after (or instead of) a build.
 * <p>
 * Plain class without Spring annotations so it can be used from the initializer and from tests
 * alike. Flyway's baseline marker is not counted as an applied migration.
 */
public class MigrationService {

    /**
     * One applied migration.
     *
     * @param database database name (e.g., "testcase_db")
     * @param version migration version, or null for repeatable seed migrations
     * @param description migration description (e.g., "versioned schema")
     * @param state migration state (e.g., "Success", "Failed")
     * @param installedOn ISO-8601 timestamp of when the migration was applied
     */
    public record AppliedMigration(
            String database,
            String version,
            String description,
            String state,
            String installedOn) {}

    /**
     * Overall migration status of a database.
     *
     * @param database database name
     * @param url JDBC connection URL
     * @param appliedMigrations number of applied migrations, versioned and repeatable
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no versioned migration applied)
     */
    public record DatabaseStatus(
            String database,
            String url,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion) {}

    private final String database;
    private final String url;
    private final Flyway flyway;

    public MigrationService(String database, String url, Flyway flyway) {
        this.database = database;
        this.url = url;
        this.flyway = flyway;
    }

    /** Current status, queried from the schema history table. */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        String currentVersion =
                current == null
                                || current.getVersion() == null
                                || current.getState() == MigrationState.BASELINE
                        ? null
                        : current.getVersion().getVersion();
        return new DatabaseStatus(
                database, url, applied(info).size(), info.pending().length, currentVersion);
    }

    /** Applied migrations in the order they were installed. */
    public List<AppliedMigration> history() {
        return applied(flyway.info()).stream()
                .map(m -> new AppliedMigration(
                        database,
                        m.getVersion() == null ? null : m.getVersion().getVersion(),
                        m.getDescription(),
                        m.getState().getDisplayName(),
                        m.getInstalledOn() == null ? null : m.getInstalledOn().toInstant().toString()))
                .toList();
    }

    private static List<MigrationInfo> applied(MigrationInfoService info) {
        return Arrays.stream(info.applied())
                .filter(m -> m.getState() != MigrationState.BASELINE)
                .toList();
    }
}
