package com.bastion.observability;

/**
 * Health status for one admission dependency or for the gateway as a whole.
 */
public enum HealthStatus {

    /** Dependency reachable within its timeout. */
    HEALTHY,

    /** Dependency unreachable but covered by a degradation policy (e.g. rate limiting fails open). */
    DEGRADED,

    /** Dependency unreachable and requests cannot be admitted correctly. */
    UNHEALTHY
}
