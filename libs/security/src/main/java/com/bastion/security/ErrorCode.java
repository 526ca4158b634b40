package com.bastion.security;

/**
 * Admission failure codes, each with the HTTP status and problem-type slug the transport
 * layer reports it under.
 */
public enum ErrorCode {

    TENANT_NOT_FOUND(404, "tenant-not-found", "Tenant not found"),
    TENANT_INACTIVE(403, "tenant-inactive", "Tenant inactive"),
    TOKEN_INVALID(401, "token-invalid", "Invalid token"),
    TOKEN_EXPIRED(401, "token-expired", "Token expired"),
    TENANT_MISMATCH(403, "tenant-mismatch", "Tenant mismatch"),
    FORBIDDEN(403, "forbidden", "Forbidden"),
    LAST_ADMIN_VIOLATION(409, "last-admin-violation", "Last admin violation"),
    RATE_LIMIT_EXCEEDED(429, "rate-limit-exceeded", "Rate limit exceeded");

    private final int httpStatus;
    private final String slug;
    private final String title;

    ErrorCode(int httpStatus, String slug, String title) {
        this.httpStatus = httpStatus;
        this.slug = slug;
        this.title = title;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Problem-type slug, e.g. {@code tenant-not-found}. */
    public String slug() {
        return slug;
    }

    public String title() {
        return title;
    }

    /** Both token failures are reported as 401 and carry a Bearer challenge. */
    public boolean isAuthenticationFailure() {
        return httpStatus == 401;
    }
}
