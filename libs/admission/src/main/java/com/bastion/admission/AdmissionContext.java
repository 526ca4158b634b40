package com.bastion.admission;

import com.bastion.security.Identity;
import com.bastion.security.TenantContext;
import com.bastion.security.rbac.Action;

/**
 * Immutable per-request result of a successful admission. Handlers read the tenant and caller
 * from here instead of deriving them again.
 */
public record AdmissionContext(TenantContext tenant, Identity identity, Action action) {

    public AdmissionContext {
        if (tenant == null || identity == null || action == null) {
            throw new IllegalArgumentException("tenant, identity and action are required");
        }
        if (!tenant.tenantId().equals(identity.tenantId())) {
            throw new IllegalArgumentException("Identity belongs to tenant " + identity.tenantId()
                    + ", not " + tenant.tenantId());
        }
    }

    public String tenantId() {
        return tenant.tenantId();
    }

    public String subjectId() {
        return identity.subjectId();
    }
}
