package com.bastion.security;

import java.time.Instant;

/**
 * An issued identity token together with the claims it encodes.
 *
 * @param subjectId subject the token was issued to
 * @param tenantId  tenant the token is bound to
 * @param role      role snapshot at issue time
 * @param issuedAt  issue instant (second precision, as encoded)
 * @param expiresAt expiry instant (second precision, as encoded)
 * @param encoded   compact serialized form sent as {@code Authorization: Bearer <encoded>}
 */
public record AuthToken(
        String subjectId,
        String tenantId,
        Role role,
        Instant issuedAt,
        Instant expiresAt,
        String encoded) {

    /** Keeps the encoded token out of logs and assertion messages. */
    @Override
    public String toString() {
        return "AuthToken[subjectId=%s, tenantId=%s, role=%s, issuedAt=%s, expiresAt=%s]"
                .formatted(subjectId, tenantId, role, issuedAt, expiresAt);
    }
}
