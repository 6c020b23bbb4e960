package com.traceforge.database;

import com.traceforge.database.migration.BootstrapDatabaseProperties;
import java.time.Duration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;

/** Connection helpers for tests running against a PostgreSQL container. */
public final class PostgresTestSupport {

    public static final String IMAGE = "postgres:16-alpine";

    private PostgresTestSupport() {
        // utility class
    }

    public static PostgreSQLContainer<?> newContainer() {
        return new PostgreSQLContainer<>(IMAGE).withDatabaseName("testcase_db");
    }

    public static BootstrapDatabaseProperties properties(PostgreSQLContainer<?> postgres) {
        return new BootstrapDatabaseProperties(
                postgres.getHost(),
                postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT),
                postgres.getDatabaseName(),
                postgres.getUsername(),
                postgres.getPassword(),
                Duration.ofSeconds(10),
                false);
    }

    /** Unpooled template for assertions, independent of the pool the initializer opens. */
    public static JdbcTemplate jdbcTemplate(PostgreSQLContainer<?> postgres) {
        return new JdbcTemplate(new DriverManagerDataSource(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword()));
    }
}
