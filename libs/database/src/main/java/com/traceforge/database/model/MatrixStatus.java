package com.traceforge.database.model;

import java.util.Optional;

/** Aggregate status of a traceability matrix row. */
public enum MatrixStatus {

    NOT_STARTED("NOT_STARTED"),
    IN_PROGRESS("IN_PROGRESS"),
    COMPLETED("COMPLETED"),
    FAILED("FAILED");

    private final String value;

    MatrixStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<MatrixStatus> fromString(String value) {
        for (MatrixStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
