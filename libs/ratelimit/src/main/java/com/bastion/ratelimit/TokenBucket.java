package com.bastion.ratelimit;

/**
 * Token bucket arithmetic shared by the in-process store. The Redis script implements the
 * same steps.
 */
final class TokenBucket {

    private TokenBucket() {
        // utility class
    }

    /**
     * Tokens available at {@code nowMillis}: the stored count plus the refill for the elapsed
     * time, never above {@code burst}. A clock that moved backwards refills nothing.
     */
    static double refill(double tokens, long lastRefillMillis, long nowMillis, BucketLimits limits) {
        long elapsedMillis = Math.max(0L, nowMillis - lastRefillMillis);
        double refilled = tokens + (elapsedMillis / 1000.0) * limits.ratePerSecond();
        return Math.min(limits.burst(), refilled);
    }
}
