package com.traceforge.database.schema;

/**
 * A DDL or DML statement failed during initialization.
 * <p>
 * Carries the offending statement text when it is known, so operators can see exactly where the
 * build stopped.
 */
public class SchemaStatementException extends SchemaBootstrapException {

    private final String statement;

    public SchemaStatementException(String statement, Throwable cause) {
        super("Failed to execute SQL: " + rootMessage(cause), cause);
        this.statement = statement;
    }

    /** The failing statement, or {@code null} if it could not be determined. */
    public String statement() {
        return statement;
    }

    private static String rootMessage(Throwable cause) {
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
