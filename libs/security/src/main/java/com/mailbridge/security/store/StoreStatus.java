package com.mailbridge.security.store;

/**
 * Outcome of {@link AuthDataStore#isReady()} or {@link AuthDataStore#isConfigured()}.
 *
 * @param ok    true when the probe succeeded
 * @param error problem description, null when {@code ok}
 */
public record StoreStatus(boolean ok, String error) {

    public static StoreStatus success() {
        return new StoreStatus(true, null);
    }

    public static StoreStatus failed(String error) {
        return new StoreStatus(false, error);
    }
}
