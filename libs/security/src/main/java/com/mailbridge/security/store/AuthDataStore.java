package com.mailbridge.security.store;

import com.mailbridge.security.AuthRecord;

import java.util.List;
import java.util.Optional;

/**
 * Storage of installation credentials, one {@link AuthRecord} per tenant.
 * <p>
 * Implementations must be safe for concurrent use by many in-flight requests.
 * Failures to reach the backing storage surface as {@link AuthDataStoreException}.
 */
public interface AuthDataStore {

    /** Looks up the installation with the given app id. */
    Optional<AuthRecord> get(String appId);

    /** Inserts or replaces the record for {@link AuthRecord#tenantApiUrl()}. */
    void set(AuthRecord record);

    /** Removes the record of the given tenant; removing an unknown tenant is not an error. */
    void delete(String tenantApiUrl);

    List<AuthRecord> list();

    /** Whether the backing storage can currently be reached. */
    StoreStatus isReady();

    /** Whether the store has everything it needs to run (paths, credentials). */
    StoreStatus isConfigured();
}
