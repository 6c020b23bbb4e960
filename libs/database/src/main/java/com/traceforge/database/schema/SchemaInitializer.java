package com.traceforge.database.schema;

import com.traceforge.database.migration.BootstrapDatabaseProperties;
import com.traceforge.database.migration.FlywayFailures;
import com.traceforge.database.migration.FlywaySchemaConfig;
import com.traceforge.database.migration.MigrationService;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.BiFunction;
import java.util.function.Function;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Rebuilds the traceability schema from scratch: connect, drop every known table, apply the
 * Flyway migrations and seed fixtures.
 * <p>
 * Running {@link #initialize()} repeatedly yields the same schema and seed rows. The first failing
 * statement aborts the run and is rethrown as a {@link SchemaBootstrapException}; the data source
 * opened for the run is closed on every exit path.
 */
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private final BootstrapDatabaseProperties properties;
    private final Function<BootstrapDatabaseProperties, HikariDataSource> dataSourceFactory;
    private final BiFunction<DataSource, BootstrapDatabaseProperties, Flyway> flywayFactory;

    public SchemaInitializer(BootstrapDatabaseProperties properties) {
        this(properties, FlywaySchemaConfig::createDataSource);
    }

    public SchemaInitializer(
            BootstrapDatabaseProperties properties,
            Function<BootstrapDatabaseProperties, HikariDataSource> dataSourceFactory) {
        this(properties, dataSourceFactory, FlywaySchemaConfig::createFlyway);
    }

    public SchemaInitializer(
            BootstrapDatabaseProperties properties,
            Function<BootstrapDatabaseProperties, HikariDataSource> dataSourceFactory,
            BiFunction<DataSource, BootstrapDatabaseProperties, Flyway> flywayFactory) {
        this.properties = properties;
        this.dataSourceFactory = dataSourceFactory;
        this.flywayFactory = flywayFactory;
    }

    /**
     * Runs one full initialization.
     *
     * @return migration status of the rebuilt schema
     * @throws DatabaseConnectionException if no connection can be established
     * @throws SchemaStatementException if any statement fails
     */
    public MigrationService.DatabaseStatus initialize() {
        log.info("Initializing database with versioning schema: {}", properties.jdbcUrl());
        try (HikariDataSource dataSource = dataSourceFactory.apply(properties)) {
            verifyConnection(dataSource);

            new SchemaTeardown(new JdbcTemplate(dataSource)).dropAll();

            Flyway flyway = flywayFactory.apply(dataSource, properties);
            MigrationService.DatabaseStatus status = build(flyway);
            log.info(
                    "Database initialization completed: {} migrations applied, schema version {}",
                    status.appliedMigrations(),
                    status.currentVersion());
            log.info("Tables created: {}", String.join(", ", SchemaCatalog.TABLES));
            return status;
        } catch (SchemaBootstrapException e) {
            log.error("Database initialization failed: {}", e.getMessage());
            throw e;
        }
    }

    private void verifyConnection(HikariDataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            log.info(
                    "Connected to database successfully ({} {})",
                    connection.getMetaData().getDatabaseProductName(),
                    connection.getMetaData().getDatabaseProductVersion());
        } catch (SQLException | HikariPool.PoolInitializationException e) {
            throw new DatabaseConnectionException(properties.jdbcUrl(), e);
        }
    }

    /** Migrates and reads back the resulting status; both talk to the database. */
    private MigrationService.DatabaseStatus build(Flyway flyway) {
        try {
            MigrateResult result = flyway.migrate();
            log.info(
                    "Applied {} migrations, target schema version {}",
                    result.migrationsExecuted,
                    result.targetSchemaVersion);
            MigrationService migrations =
                    new MigrationService(properties.database(), properties.jdbcUrl(), flyway);
            for (MigrationService.AppliedMigration applied : migrations.history()) {
                log.debug(
                        "Applied migration {} ({}) {}",
                        applied.version() == null ? "R" : applied.version(),
                        applied.description(),
                        applied.state());
            }
            return migrations.status();
        } catch (FlywayException e) {
            String statement = FlywayFailures.failedStatement(e).orElse(null);
            log.error("Failed to execute SQL: {}", FlywayFailures.summary(e));
            if (statement != null) {
                log.error("SQL: {}", statement);
            }
            throw new SchemaStatementException(statement, e);
        }
    }
}
