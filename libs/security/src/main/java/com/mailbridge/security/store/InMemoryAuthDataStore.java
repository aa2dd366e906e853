package com.mailbridge.security.store;

import com.mailbridge.security.AuthRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store, used for tests and single-instance development runs.
 */
public class InMemoryAuthDataStore implements AuthDataStore {

    private final Map<String, AuthRecord> byTenant = new ConcurrentHashMap<>();

    @Override
    public Optional<AuthRecord> get(String appId) {
        if (appId == null) {
            return Optional.empty();
        }
        return byTenant.values().stream()
                .filter(r -> r.appId().equals(appId))
                .findFirst();
    }

    @Override
    public void set(AuthRecord record) {
        byTenant.put(record.tenantApiUrl(), record);
    }

    @Override
    public void delete(String tenantApiUrl) {
        byTenant.remove(tenantApiUrl);
    }

    @Override
    public List<AuthRecord> list() {
        return List.copyOf(byTenant.values());
    }

    @Override
    public StoreStatus isReady() {
        return StoreStatus.success();
    }

    @Override
    public StoreStatus isConfigured() {
        return StoreStatus.success();
    }
}
