package com.traceforge.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Date;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationState;
import org.flywaydb.core.api.MigrationVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MigrationService} over a mocked Flyway.
 *
 * <p>WHY: The bootstrap reports status after every rebuild. Flyway's baseline marker is an
 * implementation detail and must not show up as an applied migration or as the schema version.
 */
@DisplayName("MigrationService")
class MigrationServiceTest {

    private static final String URL = "jdbc:postgresql://localhost:5432/testcase_db";

    private Flyway flyway;
    private MigrationInfoService info;
    private MigrationService service;

    @BeforeEach
    void setUp() {
        flyway = mock(Flyway.class);
        info = mock(MigrationInfoService.class);
        when(flyway.info()).thenReturn(info);
        service = new MigrationService("testcase_db", URL, flyway);
    }

    @Test
    @DisplayName("status ignores the baseline marker and counts seeds")
    void statusAfterBuild() {
        MigrationInfo baseline = migration("0", "<< Flyway Baseline >>", MigrationState.BASELINE);
        MigrationInfo v4 = migration("4", "views", MigrationState.SUCCESS);
        MigrationInfo seed = migration(null, "seed default plans", MigrationState.SUCCESS);
        MigrationInfo v1 = migration("1", "versioned schema", MigrationState.SUCCESS);
        when(info.applied()).thenReturn(new MigrationInfo[] {
            baseline, v1, v4, seed
        });
        when(info.pending()).thenReturn(new MigrationInfo[0]);
        when(info.current()).thenReturn(v4);

        var status = service.status();

        assertThat(status.database()).isEqualTo("testcase_db");
        assertThat(status.url()).isEqualTo(URL);
        assertThat(status.appliedMigrations()).isEqualTo(3);
        assertThat(status.pendingMigrations()).isZero();
        assertThat(status.currentVersion()).isEqualTo("4");
    }

    @Test
    @DisplayName("a schema holding only the baseline has no current version")
    void baselineOnly() {
        MigrationInfo baseline = migration("0", "<< Flyway Baseline >>", MigrationState.BASELINE);
        when(info.applied()).thenReturn(new MigrationInfo[] {baseline});
        MigrationInfo pending = migration("1", "versioned schema", MigrationState.PENDING);
        when(info.pending()).thenReturn(new MigrationInfo[] {
            pending
        });
        when(info.current()).thenReturn(baseline);

        var status = service.status();

        assertThat(status.appliedMigrations()).isZero();
        assertThat(status.pendingMigrations()).isEqualTo(1);
        assertThat(status.currentVersion()).isNull();
    }

    @Test
    @DisplayName("history lists applied migrations with their install time")
    void history() {
        MigrationInfo v1 = migration("1", "versioned schema", MigrationState.SUCCESS);
        when(v1.getInstalledOn()).thenReturn(new Date(0));
        MigrationInfo seed = migration(null, "seed default tenant", MigrationState.SUCCESS);
        when(info.applied()).thenReturn(new MigrationInfo[] {v1, seed});

        var history = service.history();

        assertThat(history).hasSize(2);
        assertThat(history.get(0).version()).isEqualTo("1");
        assertThat(history.get(0).state()).isEqualTo("Success");
        assertThat(history.get(0).installedOn()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(history.get(1).version()).isNull();
        assertThat(history.get(1).installedOn()).isNull();
    }

    private static MigrationInfo migration(String version, String description, MigrationState state) {
        MigrationInfo migration = mock(MigrationInfo.class);
        when(migration.getVersion()).thenReturn(version == null ? null : MigrationVersion.fromVersion(version));
        when(migration.getDescription()).thenReturn(description);
        when(migration.getState()).thenReturn(state);
        return migration;
    }
}
