package com.bastion.security;

/**
 * A verified caller: who they are, which tenant they belong to and their role there.
 * <p>
 * The core only ever obtains an identity from verified token claims; it never loads one from a
 * user store.
 *
 * @param subjectId unique user identifier (token {@code sub} claim)
 * @param tenantId  owning tenant (token {@code tenant_id} claim)
 * @param role      role snapshot taken when the token was issued
 */
public record Identity(String subjectId, String tenantId, Role role) {

    public Identity {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }
}
