package com.bastion.tenancy;

/**
 * Receives tenant deactivation events from the tenant directory.
 */
@FunctionalInterface
public interface TenantDeactivationListener {

    void onTenantDeactivated(String tenantId);
}
