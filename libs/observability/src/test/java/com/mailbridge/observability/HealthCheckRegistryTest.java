package com.mailbridge.observability;

import com.mailbridge.observability.testing.InMemoryHealthCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private final HealthCheckRegistry registry = new HealthCheckRegistry(Duration.ofMillis(200));

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("rejects blank names and null checks")
        void rejectsInvalid() {
            assertThatThrownBy(() -> registry.register(" ", new InMemoryHealthCheck("x")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("x", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects a non-positive timeout")
        void rejectsTimeout() {
            assertThatThrownBy(() -> new HealthCheckRegistry(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("replaces a check registered under the same name")
        void replaces() {
            registry.register("auth-store", new InMemoryHealthCheck("auth-store"));
            registry.register("auth-store", new InMemoryHealthCheck("auth-store").unhealthy("down"));

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("deregister reports whether something was removed")
        void deregister() {
            registry.register("auth-store", new InMemoryHealthCheck("auth-store"));

            assertThat(registry.deregister("auth-store")).isTrue();
            assertThat(registry.deregister("auth-store")).isFalse();
        }
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("an empty registry is healthy")
        void emptyIsHealthy() {
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("degraded wins over healthy, unhealthy wins over degraded")
        void worstWins() {
            registry.register("a", new InMemoryHealthCheck("a"));
            registry.register("b", new InMemoryHealthCheck("b").degraded("not configured"));
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.DEGRADED);

            registry.register("c", new InMemoryHealthCheck("c").unhealthy("down"));
            HealthResult result = registry.checkAll();
            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks()).containsOnlyKeys("a", "b", "c");
        }

        @Test
        @DisplayName("a hanging check times out as unhealthy")
        void timeout() {
            registry.register("slow", new InMemoryHealthCheck("slow").hanging());

            ComponentHealth slow = registry.checkAll().checks().get("slow");

            assertThat(slow.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(slow.message()).startsWith("Timeout or error");
        }

        @Test
        @DisplayName("a check that throws is unhealthy")
        void throwingCheck() {
            registry.register("boom", () -> {
                throw new IllegalStateException("boom");
            });
            registry.register("failed", () -> CompletableFuture.failedFuture(new IllegalStateException("nope")));

            HealthResult result = registry.checkAll();

            assertThat(result.checks().get("boom").status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("failed").status()).isEqualTo(HealthStatus.UNHEALTHY);
        }
    }
}
