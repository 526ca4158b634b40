package com.bastion.tenancy;

import com.bastion.security.Outcome;
import com.bastion.security.TenantContext;

/**
 * Maps request hints to exactly one active tenant.
 * <p>
 * Fails with {@code TENANT_NOT_FOUND} when no hint resolves and with {@code TENANT_INACTIVE}
 * when the resolved tenant has been deactivated.
 */
public interface TenantResolver {

    Outcome<TenantContext> resolve(TenantHints hints);
}
