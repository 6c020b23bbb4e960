package com.traceforge.database.model;

import java.util.Optional;

/** Direction in which a TCM testcase mapping is synchronized. */
public enum SyncDirection {

    PUSH("PUSH"),
    PULL("PULL"),
    BIDIRECTIONAL("BIDIRECTIONAL");

    private final String value;

    SyncDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SyncDirection> fromString(String value) {
        for (SyncDirection candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
