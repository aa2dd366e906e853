package com.mailbridge.security.store;

import com.mailbridge.security.AuthRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryAuthDataStore")
class InMemoryAuthDataStoreTest {

    private final InMemoryAuthDataStore store = new InMemoryAuthDataStore();

    @Test
    @DisplayName("finds a stored record by app id")
    void getByAppId() {
        var record = new AuthRecord("https://a.example.com/graphql/", "tok", "app-a", "dash.a.example.com");
        store.set(record);

        assertThat(store.get("app-a")).contains(record);
        assertThat(store.get("app-b")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    @DisplayName("a second set for the same tenant replaces the record")
    void replacesByTenant() {
        store.set(new AuthRecord("https://a.example.com/graphql/", "old", "app-a", "dash.a.example.com"));
        store.set(new AuthRecord("https://a.example.com/graphql/", "new", "app-a", "dash.a.example.com"));

        assertThat(store.list()).hasSize(1);
        assertThat(store.get("app-a")).get().extracting(AuthRecord::token).isEqualTo("new");
    }

    @Test
    @DisplayName("delete removes by tenant and tolerates unknown tenants")
    void delete() {
        store.set(new AuthRecord("https://a.example.com/graphql/", "tok", "app-a", "dash.a.example.com"));

        store.delete("https://unknown.example.com/graphql/");
        assertThat(store.list()).hasSize(1);

        store.delete("https://a.example.com/graphql/");
        assertThat(store.list()).isEmpty();
    }

    @Test
    @DisplayName("is always ready and configured")
    void status() {
        assertThat(store.isReady().ok()).isTrue();
        assertThat(store.isConfigured().ok()).isTrue();
    }
}
