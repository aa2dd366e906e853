package com.mailbridge.security.keyset;

import java.util.Optional;

/**
 * Per-tenant cache of {@link KeySet}s, keyed by tenant API URL.
 * <p>
 * Implementations must tolerate concurrent {@code put} and {@code invalidate} for the same
 * tenant: either outcome is acceptable as long as the stored entry is a complete key set.
 */
public interface KeySetCache {

    Optional<KeySet> get(String tenantApiUrl);

    void put(KeySet keySet);

    /** Drops the entry of the tenant so the next lookup fetches again. */
    void invalidate(String tenantApiUrl);
}
