package com.mailbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs registered {@link HealthCheck}s concurrently and folds them into one {@link HealthResult}.
 * <p>
 * A check that throws, fails its future, or exceeds the timeout is reported as
 * {@link HealthStatus#UNHEALTHY}. An empty registry is healthy.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    /** Default per-check timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT);
    }

    public HealthCheckRegistry(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    /**
     * Registers a check, replacing any previous check with the same name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public int size() {
        return checks.size();
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Starts every check, then waits for each one in turn.
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> running = new LinkedHashMap<>();
        checks.forEach((name, check) -> running.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : running.entrySet()) {
            ComponentHealth health = await(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), health);
            overall = overall.worst(health.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    private CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (RuntimeException e) {
            log.warn("Health check '{}' failed: {}", name, e.getMessage());
            return ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeout.toMillis());
        }
    }
}
