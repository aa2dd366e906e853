package com.mailbridge.smtpapp.infrastructure.health;

import com.mailbridge.observability.ComponentHealth;
import com.mailbridge.observability.HealthCheck;
import com.mailbridge.security.store.AuthDataStore;
import com.mailbridge.security.store.StoreStatus;
import java.util.concurrent.CompletableFuture;

/**
 * Probes the auth data store: not ready is unhealthy, ready but not configured is degraded.
 */
public class AuthDataStoreHealthCheck implements HealthCheck {

    public static final String NAME = "auth-store";

    private final AuthDataStore store;

    public AuthDataStoreHealthCheck(AuthDataStore store) {
        this.store = store;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(this::probe);
    }

    ComponentHealth probe() {
        long start = System.nanoTime();
        StoreStatus ready = store.isReady();
        if (!ready.ok()) {
            return ComponentHealth.unhealthy(NAME, ready.error(), elapsedMs(start));
        }
        StoreStatus configured = store.isConfigured();
        if (!configured.ok()) {
            return ComponentHealth.degraded(NAME, configured.error(), elapsedMs(start));
        }
        return ComponentHealth.healthy(NAME, elapsedMs(start));
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
