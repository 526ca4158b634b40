package com.bastion.admission;

import com.bastion.security.rbac.Action;
import com.bastion.security.rbac.AuthorizationTarget;
import com.bastion.tenancy.TenantHints;

/**
 * Everything the pipeline needs from one inbound request.
 *
 * @param hints               tenant hints taken from the request headers
 * @param authorizationHeader raw {@code Authorization} header value, may be null
 * @param action              the action the handler performs
 * @param target              what the action is aimed at; {@link AuthorizationTarget#none()} if nothing
 */
public record AdmissionRequest(
        TenantHints hints,
        String authorizationHeader,
        Action action,
        AuthorizationTarget target) {

    public AdmissionRequest {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (hints == null) {
            hints = new TenantHints(null, null, null);
        }
        if (target == null) {
            target = AuthorizationTarget.none();
        }
    }

    public static AdmissionRequest of(TenantHints hints, String authorizationHeader, Action action) {
        return new AdmissionRequest(hints, authorizationHeader, action, AuthorizationTarget.none());
    }
}
