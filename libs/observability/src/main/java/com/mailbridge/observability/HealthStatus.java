package com.mailbridge.observability;

/**
 * Health of one component, or of the whole service.
 */
public enum HealthStatus {

    /** Component is usable. */
    HEALTHY,

    /** Component answers but reports a problem (for example, reachable but not configured). */
    DEGRADED,

    /** Component cannot serve requests. */
    UNHEALTHY;

    /**
     * Returns the worse of the two statuses.
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
