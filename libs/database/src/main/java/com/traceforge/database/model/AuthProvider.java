package com.traceforge.database.model;

import java.util.Optional;

/** Identity provider a user authenticates with. Closed set, enforced by a check constraint. */
enum AuthProvider {

    GOOGLE("GOOGLE"),
    LINKEDIN("LINKEDIN"),
    LDAP("LDAP"),
    SAML("SAML"),
    LOCAL("LOCAL"),
    EMBEDDED("EMBEDDED");

    private final String value;

    AuthProvider(String value) {
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
    public static Optional<AuthProvider> fromString(String value) {
        for (AuthProvider candidate : values()) {
            if (candidate.value.equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
