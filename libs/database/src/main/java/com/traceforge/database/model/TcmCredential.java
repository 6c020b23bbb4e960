package com.traceforge.database.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Credentials for one TCM integration.
 * <p>
 * Either a non-empty API key, or a non-empty username together with a non-empty password, must be
 * present. The {@code check_auth_method} constraint enforces the same rule in the database.
 *
 * @param integrationId owning integration
 * @param baseUrl base URL of the tool instance
 * @param apiKey API key, may be null
 * @param username user name for basic authentication, may be null
 * @param password password for basic authentication, may be null
 */
public record TcmCredential(
        UUID integrationId, String baseUrl, String apiKey, String username, String password) {

    private static final String REDACTED = "[REDACTED]";

    public TcmCredential {
        Objects.requireNonNull(integrationId, "integrationId");
        if (isBlank(baseUrl)) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (isBlank(apiKey) && (isBlank(username) || isBlank(password))) {
            throw new IllegalArgumentException(
                    "Credential requires an API key or a username and password");
        }
    }

    public static TcmCredential apiKey(UUID integrationId, String baseUrl, String apiKey) {
        return new TcmCredential(integrationId, baseUrl, apiKey, null, null);
    }

    public static TcmCredential basic(
            UUID integrationId, String baseUrl, String username, String password) {
        return new TcmCredential(integrationId, baseUrl, null, username, password);
    }

    public boolean usesApiKey() {
        return !isBlank(apiKey);
    }

    @Override
    public String toString() {
        return "TcmCredential[integrationId=%s, baseUrl=%s, apiKey=%s, username=%s, password=%s]"
                .formatted(
                        integrationId,
                        baseUrl,
                        apiKey == null ? null : REDACTED,
                        username,
                        password == null ? null : REDACTED);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
