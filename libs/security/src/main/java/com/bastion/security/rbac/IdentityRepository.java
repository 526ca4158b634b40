package com.bastion.security.rbac;

import com.bastion.security.Role;

import java.util.Optional;

/**
 * Read access to the identity directory, which lives outside the admission core.
 */
public interface IdentityRepository {

    /** Number of identities holding {@link Role#ADMIN} in the tenant right now. */
    int countAdminsInTenant(String tenantId);

    /** Current role of a subject in the tenant, if the subject exists there. */
    Optional<Role> findRole(String tenantId, String subjectId);
}
