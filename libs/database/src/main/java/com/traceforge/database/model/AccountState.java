package com.traceforge.database.model;

import java.util.Optional;

/** Activation state shared by {@code tenants.tenant_state} and {@code users.state}. */
public enum AccountState {

    ACTIVE("ACTIVE"),
    PENDING("PENDING");

    private final String value;

    AccountState(String value) {
        this.value = value;
    }

    /** The value stored in the database column. */
    public String value() {
        return value;
    }

    public static Optional<AccountState> fromString(String value) {
        for (AccountState candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
