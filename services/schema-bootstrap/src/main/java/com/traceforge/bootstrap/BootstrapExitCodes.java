package com.traceforge.bootstrap;

import com.traceforge.database.schema.DatabaseConnectionException;
import com.traceforge.database.schema.SchemaStatementException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/** Maps initialization failures to process exit codes. */
@Component
public class BootstrapExitCodes implements ExitCodeExceptionMapper {

    public static final int CONNECTION_FAILED = 1;
    public static final int STATEMENT_FAILED = 2;
    public static final int UNEXPECTED_FAILURE = 3;

    @Override
    public int getExitCode(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof DatabaseConnectionException) {
                return CONNECTION_FAILED;
            }
            if (current instanceof SchemaStatementException) {
                return STATEMENT_FAILED;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return UNEXPECTED_FAILURE;
    }
}
