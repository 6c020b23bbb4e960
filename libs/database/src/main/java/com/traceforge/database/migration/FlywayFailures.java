package com.traceforge.database.migration;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts details from Flyway's failure reports.
 * <p>
 * Flyway renders a failed script statement as a block of {@code Key : value} lines ending with
 * {@code Statement  : <sql>}; the statement may span several lines.
 */
public final class FlywayFailures {

    private static final Pattern STATEMENT =
            Pattern.compile("^Statement\\s*:\\s*(.+)", Pattern.MULTILINE | Pattern.DOTALL);

    private static final Pattern MESSAGE = Pattern.compile("^Message\\s*:\\s*(.+)$", Pattern.MULTILINE);

    private FlywayFailures() {
        // utility class
    }

    /** The failing SQL statement reported anywhere in the cause chain, if any. */
    public static Optional<String> failedStatement(Throwable failure) {
        return find(failure, STATEMENT);
    }

    /** The database error message if Flyway reported one, otherwise the exception message. */
    public static String summary(Throwable failure) {
        return find(failure, MESSAGE).orElse(failure.getMessage());
    }

    private static Optional<String> find(Throwable failure, Pattern pattern) {
        for (Throwable current = failure; current != null; current = next(current)) {
            String message = current.getMessage();
            if (message == null) {
                continue;
            }
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                String value = matcher.group(1).strip();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static Throwable next(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }
}
