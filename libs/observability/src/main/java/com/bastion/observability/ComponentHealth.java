package com.bastion.observability;

/**
 * Health result for a single component.
 *
 * @param name      component name (e.g. "rate-limit-store", "tenant-directory")
 * @param status    health status of this component
 * @param message   optional detail, typically the failure cause
 * @param latencyMs time taken by the probe in milliseconds
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
