package com.mailbridge.security.keyset;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link KeySetCache} backed by a {@link ConcurrentHashMap}, with an optional time to live.
 * <p>
 * Entries older than the TTL are treated as absent and removed on lookup. A zero or null TTL
 * keeps entries until they are invalidated. There is no lock around fetch-and-put: two
 * requests missing the cache at the same time each fetch, and the last {@code put} wins.
 */
public class InMemoryKeySetCache implements KeySetCache {

    private final Map<String, KeySet> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryKeySetCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public InMemoryKeySetCache(Duration ttl, Clock clock) {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = clock;
    }

    @Override
    public Optional<KeySet> get(String tenantApiUrl) {
        KeySet entry = entries.get(tenantApiUrl);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(tenantApiUrl, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(KeySet keySet) {
        entries.put(keySet.tenantApiUrl(), keySet);
    }

    @Override
    public void invalidate(String tenantApiUrl) {
        entries.remove(tenantApiUrl);
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(KeySet entry) {
        return !ttl.isZero() && entry.fetchedAt().plus(ttl).isBefore(clock.instant());
    }
}
