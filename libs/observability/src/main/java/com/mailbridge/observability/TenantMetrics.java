package com.mailbridge.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters tagged with the service name and the tenant of the current request.
 * <p>
 * The {@value #TAG_TENANT} tag is read from {@link CorrelationContextHolder} at the moment
 * a meter is looked up, so callers must resolve the meter inside the request (or inside a
 * task wrapped with {@link CorrelationContextHolder#wrap(Runnable)}). Outside any tenant
 * the tag value is {@value #UNKNOWN_TENANT}.
 */
public final class TenantMetrics {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_TENANT = "tenant";
    public static final String UNKNOWN_TENANT = "unknown";

    private final MeterRegistry registry;
    private final String serviceName;

    public TenantMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns (registering on first use) a counter for the current tenant.
     *
     * @param tags extra key/value pairs, e.g. {@code "reason", "bad-signature"}
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /**
     * Returns (registering on first use) a timer for the current tenant.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Tags tags(String... extra) {
        String tenant = CorrelationContextHolder.get()
                .map(CorrelationContext::tenantApiUrl)
                .orElse(UNKNOWN_TENANT);
        return Tags.of(TAG_SERVICE, serviceName, TAG_TENANT, tenant).and(extra);
    }
}
