package com.traceforge.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.traceforge.database.schema.SchemaCatalog;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Verifies the migration and seed SQL files are packaged on the classpath and describe the
 * objects the schema catalog names.
 *
 * <p>WHY: A missing or renamed SQL file does not fail compilation. Flyway would skip it and the
 * bootstrap would report success on an incomplete schema.
 */
@DisplayName("Migration SQL Resource Verification")
class MigrationResourceTest {

    private static final String MIGRATIONS = "db/migration/traceforge/";
    private static final String SEEDS = "db/seed/reference/";

    @Nested
    @DisplayName("Versioned migrations")
    class VersionedMigrations {

        @Test
        @DisplayName("all four migrations are on the classpath")
        void migrationsOnClasspath() {
            for (String file : List.of(
                    "V1__versioned_schema.sql", "V2__indexes.sql", "V3__triggers.sql", "V4__views.sql")) {
                assertThat(getClass().getClassLoader().getResource(MIGRATIONS + file))
                        .as("%s must be on the classpath", file)
                        .isNotNull();
            }
        }

        @Test
        @DisplayName("V1 creates every catalog table and enables pgcrypto")
        void schemaCreatesEveryTable() throws IOException {
            String sql = read(MIGRATIONS + "V1__versioned_schema.sql");

            assertThat(sql).contains("CREATE EXTENSION IF NOT EXISTS pgcrypto");
            for (String table : SchemaCatalog.TABLES) {
                assertThat(sql).as("must create %s", table).contains("CREATE TABLE " + table + " (");
            }
        }

        @Test
        @DisplayName("V1 creates tables in catalog order")
        void schemaOrderMatchesCatalog() throws IOException {
            String sql = read(MIGRATIONS + "V1__versioned_schema.sql");

            int previous = -1;
            for (String table : SchemaCatalog.TABLES) {
                int position = sql.indexOf("CREATE TABLE " + table + " (");
                assertThat(position).as("%s out of order", table).isGreaterThan(previous);
                previous = position;
            }
        }

        @Test
        @DisplayName("versioned entities are unique by id and version")
        void versionUniqueness() throws IOException {
            String sql = read(MIGRATIONS + "V1__versioned_schema.sql");

            assertThat(sql).contains("UNIQUE(requirement_id, version)");
            assertThat(sql).contains("UNIQUE(testcase_id, version)");
            assertThat(sql).contains("REFERENCES testcases(testcase_id, version) ON DELETE CASCADE");
            assertThat(sql).contains("REFERENCES requirements(requirement_id, version) ON DELETE CASCADE");
        }

        @Test
        @DisplayName("credentials require an api key or a username and password")
        void credentialCheck() throws IOException {
            String sql = read(MIGRATIONS + "V1__versioned_schema.sql");

            assertThat(sql).contains("CONSTRAINT check_auth_method CHECK");
        }

        @Test
        @DisplayName("V2 creates the partial unique indexes")
        void partialUniqueIndexes() throws IOException {
            String sql = read(MIGRATIONS + "V2__indexes.sql");

            assertThat(sql).contains(
                    "CREATE UNIQUE INDEX ux_tenants_primary_domain ON tenants(primary_domain) WHERE primary_domain IS NOT NULL");
            assertThat(sql).contains(
                    "CREATE UNIQUE INDEX ux_users_provider_subject ON users(auth_provider, external_subject) WHERE external_subject IS NOT NULL");
        }

        @Test
        @DisplayName("V3 installs an updated_at trigger on every audited table")
        void auditTriggers() throws IOException {
            String sql = read(MIGRATIONS + "V3__triggers.sql");

            assertThat(sql).containsIgnoringCase("CREATE OR REPLACE FUNCTION update_updated_at_column");
            for (String table : SchemaCatalog.AUDITED_TABLES) {
                assertThat(sql).contains(
                        "CREATE TRIGGER " + SchemaCatalog.auditTriggerName(table) + " BEFORE UPDATE ON " + table);
            }
        }

        @Test
        @DisplayName("V3 installs the TCM mapping cleanup trigger")
        void cascadeTrigger() throws IOException {
            String sql = read(MIGRATIONS + "V3__triggers.sql");

            assertThat(sql).contains("CREATE TRIGGER " + SchemaCatalog.TCM_MAPPING_DELETE_TRIGGER);
            assertThat(sql).contains("AFTER DELETE ON tcm_testcase_mappings");
            assertThat(sql).contains("s.source = OLD.tcm_tool");
        }

        @Test
        @DisplayName("V4 creates the requirement sections view")
        void view() throws IOException {
            String sql = read(MIGRATIONS + "V4__views.sql");

            assertThat(sql).contains("CREATE OR REPLACE VIEW " + SchemaCatalog.REQUIREMENT_SECTIONS_VIEW);
        }
    }

    @Nested
    @DisplayName("Seed fixtures")
    class SeedFixtures {

        @Test
        @DisplayName("default tenant seed is insert-if-absent")
        void tenantSeed() throws IOException {
            String sql = read(SEEDS + "R__seed_default_tenant.sql");

            assertThat(sql).contains("'00000000-0000-0000-0000-000000000000'");
            assertThat(sql).contains("ON CONFLICT (tenant_id) DO NOTHING");
        }

        @Test
        @DisplayName("plan seed inserts Free, Pro and Unlimited if absent")
        void planSeed() throws IOException {
            String sql = read(SEEDS + "R__seed_default_plans.sql");

            assertThat(sql).contains("('Free'", "('Pro'", "('Unlimited'");
            assertThat(sql).contains("\"uploads\": -1");
            assertThat(sql).contains("ON CONFLICT (name) DO NOTHING");
        }
    }

    // ── Helpers ──

    private String read(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
