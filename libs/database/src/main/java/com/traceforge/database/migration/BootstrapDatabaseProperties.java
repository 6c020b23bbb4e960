package com.traceforge.database.migration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and build settings for a schema initialization run.
 * <p>
 * Bound from {@code traceforge.bootstrap.*}; the bootstrap application maps the
 * {@code DB_HOST}, {@code DB_PORT}, {@code DB_NAME}, {@code DB_USER} and {@code DB_PASSWORD}
 * environment variables onto these keys. Missing values fall back to local defaults in the
 * compact constructor, which runs before Bean Validation.
 *
 * <pre>{@code
 * traceforge:
 *   bootstrap:
 *     host: localhost
 *     port: 5432
 *     database: testcase_db
 *     username: postgres
 *     password: password
 *     connect-timeout: 30s
 *     group-migrations: false
 * }</pre>
 *
 * @param host database host
 * @param port database port
 * @param database database name
 * @param username database user
 * @param password database password
 * @param connectTimeout how long to wait for the first connection
 * @param groupMigrations apply all pending migrations in a single transaction
 */
@Validated
@ConfigurationProperties(prefix = "traceforge.bootstrap")
public record BootstrapDatabaseProperties(
        @NotBlank String host,
        @Min(1) @Max(65535) int port,
        @NotBlank String database,
        @NotBlank String username,
        String password,
        Duration connectTimeout,
        boolean groupMigrations) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5432;
    public static final String DEFAULT_DATABASE = "testcase_db";
    public static final String DEFAULT_USERNAME = "postgres";
    public static final String DEFAULT_PASSWORD = "password";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    public BootstrapDatabaseProperties {
        if (host == null || host.isBlank()) {
            host = DEFAULT_HOST;
        }
        if (port <= 0) {
            port = DEFAULT_PORT;
        }
        if (database == null || database.isBlank()) {
            database = DEFAULT_DATABASE;
        }
        if (username == null || username.isBlank()) {
            username = DEFAULT_USERNAME;
        }
        if (password == null) {
            password = DEFAULT_PASSWORD;
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
    }

    /** Settings with every value defaulted. */
    public static BootstrapDatabaseProperties defaults() {
        return new BootstrapDatabaseProperties(null, 0, null, null, null, null, false);
    }

    /** PostgreSQL JDBC URL for these settings. */
    public String jdbcUrl() {
        return "jdbc:postgresql://%s:%d/%s".formatted(host, port, database);
    }

    @Override
    public String toString() {
        return "BootstrapDatabaseProperties[url=%s, username=%s, password=[REDACTED], connectTimeout=%s, groupMigrations=%s]"
                .formatted(jdbcUrl(), username, connectTimeout, groupMigrations);
    }
}
