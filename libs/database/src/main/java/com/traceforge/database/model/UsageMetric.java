package com.traceforge.database.model;

import java.util.Optional;

/**
 * Metered quantities. The value doubles as the key inside {@code plans.limits} and as
 * {@code usage.metric}.
 */
public enum UsageMetric {

    UPLOADS("uploads"),
    TESTCASES("testcases"),
    API_CALLS("api_calls");

    private final String value;

    UsageMetric(String value) {
        this.value = value;
    }

    /** The value stored in the database column. */
    public String value() {
        return value;
    }

    /**
     * Looks up a constant by its stored column value.
     *
     * @param value the column value to match (case-sensitive)
     * @return the matching constant, or empty if not found
     */
    public static Optional<UsageMetric> fromString(String value) {
        for (UsageMetric candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
