package com.bastion.security.rbac;

import com.bastion.security.Role;

/**
 * Authorization rule attached to an {@link Action}.
 *
 * @param minimumRole           role that passes regardless of ownership
 * @param ownerMinimumRole      role the resource owner needs to pass, or null when ownership grants nothing
 * @param identityManagement    the action removes or demotes an identity, so the last-admin guard applies
 * @param selfTargetForbidden   a subject may not aim the action at itself
 */
public record ActionPolicy(
        Role minimumRole,
        Role ownerMinimumRole,
        boolean identityManagement,
        boolean selfTargetForbidden) {

    public ActionPolicy {
        if (minimumRole == null) {
            throw new IllegalArgumentException("minimumRole must not be null");
        }
        if (ownerMinimumRole != null && ownerMinimumRole.compareTo(minimumRole) > 0) {
            throw new IllegalArgumentException("ownerMinimumRole must not exceed minimumRole");
        }
    }

    public static ActionPolicy minimum(Role role) {
        return new ActionPolicy(role, null, false, false);
    }

    public ActionPolicy orOwnerWith(Role role) {
        return new ActionPolicy(minimumRole, role, identityManagement, selfTargetForbidden);
    }

    public ActionPolicy guardingLastAdmin() {
        return new ActionPolicy(minimumRole, ownerMinimumRole, true, selfTargetForbidden);
    }

    public ActionPolicy forbiddingSelf() {
        return new ActionPolicy(minimumRole, ownerMinimumRole, identityManagement, true);
    }

    public boolean ownerEligible() {
        return ownerMinimumRole != null;
    }
}
