package com.bastion.security;

/**
 * Resource-level tenant check for handlers running after admission.
 * <p>
 * Admission binds the caller to one tenant; handlers that load tenant-scoped records call
 * {@link #enforce(Identity, String)} before acting on them.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @throws TenantMismatchException if the resource belongs to another tenant
     */
    public static void enforce(Identity identity, String resourceTenantId) {
        if (!identity.tenantId().equals(resourceTenantId)) {
            throw new TenantMismatchException(identity.tenantId(), resourceTenantId);
        }
    }
}
