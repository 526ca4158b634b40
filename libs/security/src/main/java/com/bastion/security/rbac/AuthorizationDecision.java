package com.bastion.security.rbac;

/**
 * Outcome of an RBAC check.
 *
 * @param allowed whether the action may proceed
 * @param reason  why it was denied, null when allowed
 * @param message human-readable explanation, null when allowed
 */
public record AuthorizationDecision(boolean allowed, DenyReason reason, String message) {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null, null);

    public AuthorizationDecision {
        if (!allowed && reason == null) {
            throw new IllegalArgumentException("A denial must carry a reason");
        }
    }

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(DenyReason reason, String message) {
        return new AuthorizationDecision(false, reason, message);
    }
}
