package com.traceforge.database.model;

import java.util.Optional;

/** Kind of tenant: a single person or an organization. */
public enum TenantType {

    PERSONAL("PERSONAL"),
    ORGANIZATION("ORGANIZATION");

    private final String value;

    TenantType(String value) {
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
    public static Optional<TenantType> fromString(String value) {
        for (TenantType candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
