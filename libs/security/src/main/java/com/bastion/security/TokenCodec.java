package com.bastion.security;

/**
 * Issues and verifies signed identity tokens.
 * <p>
 * A verified token always yields an {@link Identity} whose tenant equals the tenant the
 * request was resolved to; a token bound to any other tenant is rejected even when its
 * signature is valid.
 */
public interface TokenCodec {

    /**
     * Issues a token for {@code identity} bound to {@code tenant}.
     *
     * @throws IllegalArgumentException if the identity does not belong to the tenant
     */
    AuthToken issue(Identity identity, TenantContext tenant);

    /**
     * Verifies {@code rawToken} against {@code expectedTenant}.
     * <p>
     * Checks run in a fixed order and the first failure wins: signature and structure
     * ({@link ErrorCode#TOKEN_INVALID}), expiry ({@link ErrorCode#TOKEN_EXPIRED}), tenant binding
     * ({@link ErrorCode#TENANT_MISMATCH}).
     */
    Outcome<Identity> verify(String rawToken, TenantContext expectedTenant);
}
