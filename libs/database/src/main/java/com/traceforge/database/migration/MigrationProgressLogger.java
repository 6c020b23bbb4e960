package com.traceforge.database.migration;

import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.callback.Callback;
import org.flywaydb.core.api.callback.Context;
import org.flywaydb.core.api.callback.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs one line per applied or failed migration. */
class MigrationProgressLogger implements Callback {

    private static final Logger log = LoggerFactory.getLogger(MigrationProgressLogger.class);

    @Override
    public boolean supports(Event event, Context context) {
        return event == Event.AFTER_EACH_MIGRATE || event == Event.AFTER_EACH_MIGRATE_ERROR;
    }

    @Override
    public boolean canHandleInTransaction(Event event, Context context) {
        return true;
    }

    @Override
    public void handle(Event event, Context context) {
        MigrationInfo migration = context.getMigrationInfo();
        if (migration == null) {
            return;
        }
        if (event == Event.AFTER_EACH_MIGRATE) {
            log.info("Applied {}", migration.getScript());
        } else {
            log.error("Migration {} failed", migration.getScript());
        }
    }

    @Override
    public String getCallbackName() {
        return "traceforge-progress";
    }
}
