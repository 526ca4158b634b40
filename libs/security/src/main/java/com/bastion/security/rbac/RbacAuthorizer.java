package com.bastion.security.rbac;

import com.bastion.security.Identity;
import com.bastion.security.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an identity may perform an {@link Action}.
 * <p>
 * Checks run in order: role (with the owner exemption for owner-eligible actions), then the
 * last-admin guard for identity-management actions, then self-targeting. The last-admin guard
 * reads the admin count from the {@link IdentityRepository} at decision time; the
 * read-then-act window against a concurrent removal is closed by the directory, not here.
 */
public class RbacAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RbacAuthorizer.class);

    private final IdentityRepository identityRepository;

    public RbacAuthorizer(IdentityRepository identityRepository) {
        this.identityRepository = identityRepository;
    }

    public AuthorizationDecision authorize(Identity identity, Action action, AuthorizationTarget target) {
        AuthorizationTarget effectiveTarget = target == null ? AuthorizationTarget.none() : target;
        ActionPolicy policy = action.policy();
        boolean isOwner = effectiveTarget.ownerId() != null
                && effectiveTarget.ownerId().equals(identity.subjectId());

        if (!identity.role().atLeast(policy.minimumRole())) {
            if (!policy.ownerEligible()) {
                return insufficientRole(identity, action, policy.minimumRole());
            }
            if (!isOwner) {
                if (effectiveTarget.ownerId() == null) {
                    return insufficientRole(identity, action, policy.minimumRole());
                }
                return AuthorizationDecision.deny(DenyReason.OWNERSHIP_MISMATCH,
                        "Action '%s' requires role '%s' or ownership of the resource"
                                .formatted(action.value(), policy.minimumRole().value()));
            }
            if (!identity.role().atLeast(policy.ownerMinimumRole())) {
                return insufficientRole(identity, action, policy.ownerMinimumRole());
            }
        }

        if (policy.identityManagement()) {
            AuthorizationTarget resolved = withCurrentRole(identity, effectiveTarget);
            if (resolved.removesAdmin()) {
                int admins = identityRepository.countAdminsInTenant(identity.tenantId());
                if (admins <= 1) {
                    log.debug("Refusing {} on last admin of tenant {}", action, identity.tenantId());
                    return AuthorizationDecision.deny(DenyReason.LAST_ADMIN,
                            "Tenant must keep at least one admin");
                }
            }
        }

        if (policy.selfTargetForbidden() && isOwner) {
            return AuthorizationDecision.deny(DenyReason.SELF_REMOVAL,
                    "Action '%s' cannot target your own account".formatted(action.value()));
        }
        return AuthorizationDecision.allow();
    }

    private AuthorizationTarget withCurrentRole(Identity identity, AuthorizationTarget target) {
        if (target.targetRole() != null || target.ownerId() == null) {
            return target;
        }
        Role current = identityRepository.findRole(identity.tenantId(), target.ownerId()).orElse(null);
        return target.withTargetRole(current);
    }

    private static AuthorizationDecision insufficientRole(Identity identity, Action action, Role required) {
        return AuthorizationDecision.deny(DenyReason.INSUFFICIENT_ROLE,
                "Action '%s' requires role '%s', caller has '%s'"
                        .formatted(action.value(), required.value(), identity.role().value()));
    }
}
