package com.bastion.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A lightweight probe of one admission dependency.
 * <p>
 * Probes return asynchronously so that {@link HealthCheckRegistry} can run them side by side
 * and bound each one with a timeout.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
