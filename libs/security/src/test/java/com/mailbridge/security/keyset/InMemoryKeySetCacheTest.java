package com.mailbridge.security.keyset;

import com.nimbusds.jose.jwk.JWKSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryKeySetCache")
class InMemoryKeySetCacheTest {

    private static final String TENANT = "https://shop.example.com/graphql/";
    private static final Instant FETCHED = Instant.parse("2026-01-01T10:00:00Z");

    private static KeySet keySet(Instant fetchedAt) {
        return new KeySet(TENANT, new JWKSet(), fetchedAt);
    }

    @Test
    @DisplayName("returns entries within the TTL")
    void withinTtl() {
        var clock = Clock.fixed(FETCHED.plus(Duration.ofMinutes(59)), ZoneOffset.UTC);
        var cache = new InMemoryKeySetCache(Duration.ofHours(1), clock);
        cache.put(keySet(FETCHED));

        assertThat(cache.get(TENANT)).isPresent();
    }

    @Test
    @DisplayName("drops entries older than the TTL")
    void expired() {
        var clock = Clock.fixed(FETCHED.plus(Duration.ofMinutes(61)), ZoneOffset.UTC);
        var cache = new InMemoryKeySetCache(Duration.ofHours(1), clock);
        cache.put(keySet(FETCHED));

        assertThat(cache.get(TENANT)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("zero TTL keeps entries until invalidated")
    void noExpiry() {
        var clock = Clock.fixed(FETCHED.plus(Duration.ofDays(365)), ZoneOffset.UTC);
        var cache = new InMemoryKeySetCache(Duration.ZERO, clock);
        cache.put(keySet(FETCHED));

        assertThat(cache.get(TENANT)).isPresent();
        cache.invalidate(TENANT);
        assertThat(cache.get(TENANT)).isEmpty();
    }

    @Test
    @DisplayName("concurrent refresh and lookup never expose another tenant's keys")
    void concurrentRefreshAndLookup() throws Exception {
        var cache = new InMemoryKeySetCache(Duration.ofHours(1));
        List<String> tenants = List.of(TENANT, "https://other.example.com/graphql/");
        tenants.forEach(tenant -> cache.put(new KeySet(tenant, new JWKSet(), Instant.now())));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger hits = new AtomicInteger();
        List<Future<?>> workers = new ArrayList<>();
        try {
            for (int worker = 0; worker < 8; worker++) {
                String tenant = tenants.get(worker % tenants.size());
                boolean refresher = worker < 4;
                workers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        if (refresher) {
                            cache.invalidate(tenant);
                            cache.put(new KeySet(tenant, new JWKSet(), Instant.now()));
                        } else {
                            Optional<KeySet> found = cache.get(tenant);
                            if (found.isPresent()) {
                                assertThat(found.get().tenantApiUrl()).isEqualTo(tenant);
                                hits.incrementAndGet();
                            }
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : workers) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(hits.get()).isPositive();
        assertThat(cache.get(TENANT)).isPresent();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("rejects a negative TTL")
    void negativeTtl() {
        assertThatThrownBy(() -> new InMemoryKeySetCache(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
