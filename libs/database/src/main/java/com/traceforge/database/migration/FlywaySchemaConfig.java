package com.traceforge.database.migration;

import com.traceforge.database.schema.SchemaCatalog;
import com.traceforge.database.schema.SchemaInitializer;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the schema bootstrap, plus the factories that build the per-run data source
 * and Flyway instance.
 * <p>
 * Spring Boot's own Flyway auto-configuration must stay off in applications importing this class:
 * the migrations only run as part of {@link SchemaInitializer#initialize()}, after teardown.
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(BootstrapDatabaseProperties.class)
public class FlywaySchemaConfig {

    /** Baseline version used when teardown leaves non-table objects (functions, extensions). */
    static final String BASELINE_VERSION = "0";

    @Bean
    public SchemaInitializer schemaInitializer(BootstrapDatabaseProperties properties) {
        return new SchemaInitializer(properties);
    }

    /**
     * Creates the data source for one run. The pool connects lazily, so an unreachable database
     * surfaces on the first {@code getConnection()} call.
     */
    public static HikariDataSource createDataSource(BootstrapDatabaseProperties properties) {
        HikariDataSource dataSource =
                DataSourceBuilder.create()
                        .type(HikariDataSource.class)
                        .driverClassName("org.postgresql.Driver")
                        .url(properties.jdbcUrl())
                        .username(properties.username())
                        .password(properties.password())
                        .build();
        dataSource.setPoolName("traceforge-bootstrap");
        dataSource.setConnectionTimeout(properties.connectTimeout().toMillis());
        dataSource.setMaximumPoolSize(2);
        return dataSource;
    }

    /**
     * Creates the Flyway instance that builds the schema and applies the seed fixtures.
     * <p>
     * {@code clean} stays disabled; teardown is done by
     * {@link com.traceforge.database.schema.SchemaTeardown}, which drops the known tables only.
     * Baselining at version 0 lets the build run on a schema where teardown left functions or
     * extension objects behind, while still applying V1 onwards.
     */
    public static Flyway createFlyway(DataSource dataSource, BootstrapDatabaseProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(SchemaCatalog.MIGRATION_LOCATION, SchemaCatalog.SEED_LOCATION)
                .table(SchemaCatalog.SCHEMA_HISTORY_TABLE)
                .baselineOnMigrate(true)
                .baselineVersion(BASELINE_VERSION)
                .group(properties.groupMigrations())
                .cleanDisabled(true)
                .callbacks(new MigrationProgressLogger())
                .load();
    }
}
