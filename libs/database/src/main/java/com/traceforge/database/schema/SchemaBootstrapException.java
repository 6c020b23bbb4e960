package com.traceforge.database.schema;

/**
 * Base type for failures that abort a schema initialization run. Every failure is terminal for
 * the run; there is no retry.
 */
public abstract class SchemaBootstrapException extends RuntimeException {

    protected SchemaBootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
