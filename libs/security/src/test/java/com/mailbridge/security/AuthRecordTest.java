package com.mailbridge.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthRecord")
class AuthRecordTest {

    private static final String API_URL = "https://shop.example.com/graphql/";

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects a blank tenant API URL")
        void blankTenantApiUrl() {
            assertThatThrownBy(() -> new AuthRecord(" ", "tok", "app-1", "dash.example.com"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tenantApiUrl");
        }

        @Test
        @DisplayName("rejects a missing token")
        void missingToken() {
            assertThatThrownBy(() -> new AuthRecord(API_URL, null, "app-1", "dash.example.com"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("token");
        }

        @Test
        @DisplayName("accepts a record without key-set override")
        void noOverride() {
            var record = new AuthRecord(API_URL, "tok", "app-1", "dash.example.com");
            assertThat(record.keySetOverride()).isNull();
            assertThat(record.storedKeySet()).isEmpty();
        }
    }

    @Test
    @DisplayName("blank override counts as absent")
    void blankOverride() {
        var record = new AuthRecord(API_URL, "tok", "app-1", "dash.example.com", "  ");
        assertThat(record.storedKeySet()).isEmpty();
    }

    @Test
    @DisplayName("withToken keeps identity and replaces the token")
    void withToken() {
        var record = new AuthRecord(API_URL, "old", "app-1", "dash.example.com", "{\"keys\":[]}");
        var rotated = record.withToken("new");

        assertThat(rotated.token()).isEqualTo("new");
        assertThat(rotated.tenantApiUrl()).isEqualTo(API_URL);
        assertThat(rotated.appId()).isEqualTo("app-1");
        assertThat(rotated.keySetOverride()).isEqualTo("{\"keys\":[]}");
    }

    @Test
    @DisplayName("toString does not reveal the token")
    void toStringHidesToken() {
        var record = new AuthRecord(API_URL, "very-secret-token", "app-1", "dash.example.com");
        assertThat(record.toString()).doesNotContain("very-secret-token").contains("app-1");
    }
}
