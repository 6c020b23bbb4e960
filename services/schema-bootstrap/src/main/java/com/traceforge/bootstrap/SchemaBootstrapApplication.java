package com.traceforge.bootstrap;

import com.traceforge.database.migration.FlywaySchemaConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Command-line entry point that rebuilds and seeds the traceability schema once, then exits.
 * <p>
 * Connection settings come from the environment ({@code DB_HOST}, {@code DB_PORT},
 * {@code DB_NAME}, {@code DB_USER}, {@code DB_PASSWORD}). Exit status: {@code 0} on success,
 * {@code 1} if the database is unreachable, {@code 2} if a statement fails.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@Import(FlywaySchemaConfig.class)
public class SchemaBootstrapApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SchemaBootstrapApplication.class, args)));
    }
}
