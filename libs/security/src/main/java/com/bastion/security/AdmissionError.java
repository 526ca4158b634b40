package com.bastion.security;

import java.time.Duration;

/**
 * A typed admission failure.
 *
 * @param code       failure kind
 * @param detail     human-readable detail, safe to return to the caller
 * @param reason     finer-grained reason for observability (e.g. {@code INSUFFICIENT_ROLE}), or null
 * @param retryAfter wait hint, only set for {@link ErrorCode#RATE_LIMIT_EXCEEDED}
 */
public record AdmissionError(ErrorCode code, String detail, String reason, Duration retryAfter) {

    public AdmissionError {
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
        if (detail == null || detail.isBlank()) {
            detail = code.title();
        }
        if (retryAfter != null && code != ErrorCode.RATE_LIMIT_EXCEEDED) {
            throw new IllegalArgumentException("retryAfter is only valid for " + ErrorCode.RATE_LIMIT_EXCEEDED);
        }
    }

    public static AdmissionError of(ErrorCode code, String detail) {
        return new AdmissionError(code, detail, null, null);
    }

    public static AdmissionError forbidden(String reason, String detail) {
        return new AdmissionError(ErrorCode.FORBIDDEN, detail, reason, null);
    }

    public static AdmissionError rateLimited(Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be non-negative");
        }
        return new AdmissionError(ErrorCode.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded, retry later", null, retryAfter);
    }

    /**
     * The wait hint in whole seconds for a {@code Retry-After} header: rounded up, never below 1.
     *
     * @return seconds to wait, or 0 when this error carries no wait hint
     */
    public long retryAfterSeconds() {
        if (retryAfter == null) {
            return 0;
        }
        long millis = retryAfter.toMillis();
        long seconds = (millis + 999) / 1000;
        return Math.max(1, seconds);
    }
}
