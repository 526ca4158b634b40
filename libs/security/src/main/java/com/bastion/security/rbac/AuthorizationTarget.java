package com.bastion.security.rbac;

import com.bastion.security.Role;

/**
 * What an action is aimed at.
 *
 * @param ownerId    owner of the resource, or the subject a user-management action targets; null if none
 * @param targetRole current role of the targeted identity, or null if unknown or not applicable
 * @param newRole    role being assigned by a role change, or null
 */
public record AuthorizationTarget(String ownerId, Role targetRole, Role newRole) {

    private static final AuthorizationTarget NONE = new AuthorizationTarget(null, null, null);

    public static AuthorizationTarget none() {
        return NONE;
    }

    public static AuthorizationTarget ownedBy(String ownerId) {
        return new AuthorizationTarget(ownerId, null, null);
    }

    public static AuthorizationTarget identity(String subjectId, Role currentRole) {
        return new AuthorizationTarget(subjectId, currentRole, null);
    }

    public static AuthorizationTarget roleChange(String subjectId, Role currentRole, Role newRole) {
        return new AuthorizationTarget(subjectId, currentRole, newRole);
    }

    public AuthorizationTarget withTargetRole(Role role) {
        return new AuthorizationTarget(ownerId, role, newRole);
    }

    /** Whether carrying out the action leaves the target without the admin role. */
    boolean removesAdmin() {
        return targetRole == Role.ADMIN && newRole != Role.ADMIN;
    }
}
