package com.bastion.ratelimit;

import java.time.Duration;

/**
 * Result of a rate-limit admission check.
 */
public sealed interface RateLimitDecision permits RateLimitDecision.Admitted, RateLimitDecision.Denied {

    boolean admitted();

    /** True when the store was unavailable and the degradation policy decided. */
    boolean degraded();

    /**
     * @param remaining whole tokens left in the bucket, or -1 when unknown
     */
    record Admitted(long remaining, boolean degraded) implements RateLimitDecision {

        @Override
        public boolean admitted() {
            return true;
        }
    }

    /**
     * @param retryAfter time until one token is available again
     */
    record Denied(Duration retryAfter, boolean degraded) implements RateLimitDecision {

        public Denied {
            if (retryAfter == null || retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter must be non-negative");
            }
        }

        @Override
        public boolean admitted() {
            return false;
        }
    }
}
