package com.bastion.security;

/**
 * Per-tenant replacement for the tier's traffic budget. Each component is optional; a null
 * component falls back to the tier default independently of the other.
 *
 * @param requestsPerMinute sustained refill rate, or null for the tier default
 * @param burst             bucket capacity, or null for the tier default
 */
public record RateLimitOverride(Integer requestsPerMinute, Integer burst) {

    private static final RateLimitOverride NONE = new RateLimitOverride(null, null);

    public RateLimitOverride {
        if (requestsPerMinute != null && requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive when set");
        }
        if (burst != null && burst <= 0) {
            throw new IllegalArgumentException("burst must be positive when set");
        }
    }

    public static RateLimitOverride none() {
        return NONE;
    }

    public boolean isEmpty() {
        return requestsPerMinute == null && burst == null;
    }
}
