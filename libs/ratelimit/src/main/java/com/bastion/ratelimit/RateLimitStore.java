package com.bastion.ratelimit;

import java.time.Instant;

/**
 * Shared bucket state with a single atomic mutation.
 * <p>
 * Implementations must apply refill, check and decrement as one indivisible step per key:
 * two concurrent calls on a bucket holding one token never both succeed.
 */
public interface RateLimitStore {

    /**
     * Refills the bucket stored under {@code key} for the time elapsed since its last refill,
     * capped at the burst, then takes one token if at least one is available. A missing or
     * expired bucket starts full.
     *
     * @throws RateLimitStoreUnavailableException if the store cannot be reached
     */
    ConsumeResult refillAndDecrement(String key, BucketLimits limits, Instant now);

    /**
     * Cheap reachability probe for health checks.
     *
     * @throws RateLimitStoreUnavailableException if the store cannot be reached
     */
    void ping();
}
