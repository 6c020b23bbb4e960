package com.traceforge.database.schema;

/** The initial database connection could not be established. */
public class DatabaseConnectionException extends SchemaBootstrapException {

    private final String jdbcUrl;

    public DatabaseConnectionException(String jdbcUrl, Throwable cause) {
        super("Failed to connect to database at %s: %s".formatted(jdbcUrl, cause.getMessage()), cause);
        this.jdbcUrl = jdbcUrl;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }
}
