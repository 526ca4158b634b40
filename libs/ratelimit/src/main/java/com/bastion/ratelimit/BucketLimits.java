package com.bastion.ratelimit;

/**
 * Token bucket parameters.
 *
 * @param ratePerSecond refill rate in tokens per second
 * @param burst         bucket capacity
 */
public record BucketLimits(double ratePerSecond, int burst) {

    public BucketLimits {
        if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("ratePerSecond must be positive and finite");
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be positive");
        }
    }

    public static BucketLimits perMinute(int requestsPerMinute, int burst) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        return new BucketLimits(requestsPerMinute / 60.0, burst);
    }

    public double requestsPerMinute() {
        return ratePerSecond * 60.0;
    }
}
