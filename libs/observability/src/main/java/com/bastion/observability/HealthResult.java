package com.bastion.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of all registered health checks.
 *
 * @param status    worst status among the components
 * @param checks    component results keyed by component name
 * @param timestamp when the checks completed
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
