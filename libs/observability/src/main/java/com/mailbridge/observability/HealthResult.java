package com.mailbridge.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated outcome of every registered {@link HealthCheck}.
 *
 * @param status    worst status among all components
 * @param checks    per-component results, keyed by registration name
 * @param timestamp when the checks completed
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
