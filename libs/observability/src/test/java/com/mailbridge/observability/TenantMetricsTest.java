package com.mailbridge.observability;

import com.mailbridge.observability.testing.TestCorrelationContextFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantMetrics")
class TenantMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TenantMetrics metrics = new TenantMetrics(registry, "smtp-app");

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("tags counters with the current tenant")
    void tagsTenant() {
        CorrelationContextHolder.set(TestCorrelationContextFactory.createDefault());

        metrics.counter("webhooks.mutations", "mutations", "operation", "create").increment();

        var counter = registry.get("webhooks.mutations")
                .tag(TenantMetrics.TAG_TENANT, TestCorrelationContextFactory.DEFAULT_TENANT_API_URL)
                .tag(TenantMetrics.TAG_SERVICE, "smtp-app")
                .tag("operation", "create")
                .counter();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("falls back to the unknown tenant outside a request")
    void unknownTenant() {
        metrics.timer("auth.verify", "verification time").record(java.time.Duration.ofMillis(3));

        assertThat(registry.get("auth.verify").tag(TenantMetrics.TAG_TENANT, TenantMetrics.UNKNOWN_TENANT).timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("rejects missing registry or service name")
    void rejectsInvalid() {
        assertThatThrownBy(() -> new TenantMetrics(null, "svc")).hasMessageContaining("registry");
        assertThatThrownBy(() -> new TenantMetrics(registry, "")).hasMessageContaining("serviceName");
    }
}
