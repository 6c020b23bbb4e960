package com.traceforge.database.model;

import java.util.Optional;

/** Lifecycle of a tenant's subscription to a plan. */
public enum SubscriptionStatus {

    ACTIVE("ACTIVE"),
    SUSPENDED("SUSPENDED"),
    CANCELLED("CANCELLED"),
    EXPIRED("EXPIRED");

    private final String value;

    SubscriptionStatus(String value) {
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
    public static Optional<SubscriptionStatus> fromString(String value) {
        for (SubscriptionStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
