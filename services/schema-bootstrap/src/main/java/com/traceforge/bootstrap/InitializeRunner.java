package com.traceforge.bootstrap;

import com.traceforge.database.migration.BootstrapDatabaseProperties;
import com.traceforge.database.migration.MigrationService;
import com.traceforge.database.schema.SchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the single {@code initialize} operation at startup. Arguments are ignored.
 * <p>
 * Failures propagate, which aborts startup; {@link BootstrapExitCodes} turns them into the
 * process exit status.
 */
@Component
@ConditionalOnProperty(prefix = "traceforge.bootstrap", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class InitializeRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(InitializeRunner.class);

    private final SchemaInitializer schemaInitializer;
    private final BootstrapDatabaseProperties properties;

    public InitializeRunner(SchemaInitializer schemaInitializer, BootstrapDatabaseProperties properties) {
        this.schemaInitializer = schemaInitializer;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("Starting schema bootstrap with {}", properties);
        MigrationService.DatabaseStatus status = schemaInitializer.initialize();
        log.info(
                "Schema bootstrap finished: database={}, version={}, applied={}",
                status.database(),
                status.currentVersion(),
                status.appliedMigrations());
    }
}
