package com.mailbridge.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A probe of one dependency, such as the auth data store.
 * <p>
 * Implementations should not block the caller; {@link HealthCheckRegistry} waits on the
 * returned future with a timeout.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
