package com.traceforge.database.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TcmCredential}.
 *
 * <p>WHY: A credential is either an API key or a username and password pair. Rejecting incomplete
 * combinations at construction keeps half-configured integrations out of the table.
 */
@DisplayName("TcmCredential")
class TcmCredentialTest {

    private static final UUID INTEGRATION = UUID.fromString("7d0c3f4e-3a0b-4d55-9a4e-2f3c1b6a9e10");
    private static final String BASE_URL = "https://acme.testrail.io";

    @Test
    @DisplayName("an API key alone is sufficient")
    void apiKey() {
        var credential = TcmCredential.apiKey(INTEGRATION, BASE_URL, "k-123");

        assertThat(credential.usesApiKey()).isTrue();
    }

    @Test
    @DisplayName("username and password together are sufficient")
    void basic() {
        var credential = TcmCredential.basic(INTEGRATION, BASE_URL, "qa", "secret");

        assertThat(credential.usesApiKey()).isFalse();
    }

    @Test
    @DisplayName("a username without a password is rejected")
    void usernameOnly() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new TcmCredential(INTEGRATION, BASE_URL, null, "qa", null))
                .withMessageContaining("API key or a username and password");
    }

    @Test
    @DisplayName("empty strings do not count as credentials")
    void emptyStrings() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new TcmCredential(INTEGRATION, BASE_URL, "", "", ""));
    }

    @Test
    @DisplayName("an empty base URL is rejected")
    void blankBaseUrl() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> TcmCredential.apiKey(INTEGRATION, "", "k-123"));
    }

    @Test
    @DisplayName("toString redacts secrets")
    void redacts() {
        var credential = new TcmCredential(INTEGRATION, BASE_URL, "k-123", "qa", "secret");

        assertThat(credential.toString())
                .contains("qa")
                .contains(BASE_URL)
                .doesNotContain("k-123")
                .doesNotContain("secret");
    }
}
