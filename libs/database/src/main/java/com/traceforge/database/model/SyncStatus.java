package com.traceforge.database.model;

import java.util.Optional;

/** Synchronization state of a testcase version against external TCM tools. */
public enum SyncStatus {

    NEW("NEW"),
    UPDATED("UPDATED"),
    SYNCHED("SYNCHED");

    private final String value;

    SyncStatus(String value) {
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
    public static Optional<SyncStatus> fromString(String value) {
        for (SyncStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
