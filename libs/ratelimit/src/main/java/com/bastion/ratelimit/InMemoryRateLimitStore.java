package com.bastion.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process {@link RateLimitStore}. Atomicity per key comes from
 * {@link ConcurrentHashMap#compute}; buckets idle for longer than the state TTL are dropped and
 * start full again on next use.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    public static final Duration DEFAULT_STATE_TTL = Duration.ofSeconds(60);

    private static final int SWEEP_INTERVAL = 1024;

    private final ConcurrentMap<String, BucketState> buckets = new ConcurrentHashMap<>();
    private final AtomicLong operations = new AtomicLong();
    private final long stateTtlMillis;

    public InMemoryRateLimitStore() {
        this(DEFAULT_STATE_TTL);
    }

    public InMemoryRateLimitStore(Duration stateTtl) {
        if (stateTtl == null || stateTtl.isZero() || stateTtl.isNegative()) {
            throw new IllegalArgumentException("stateTtl must be positive");
        }
        this.stateTtlMillis = stateTtl.toMillis();
    }

    @Override
    public ConsumeResult refillAndDecrement(String key, BucketLimits limits, Instant now) {
        long nowMillis = now.toEpochMilli();
        AtomicReference<ConsumeResult> result = new AtomicReference<>();

        buckets.compute(key, (k, current) -> {
            double tokens;
            if (current == null || current.isExpired(nowMillis)) {
                tokens = limits.burst();
            } else {
                tokens = TokenBucket.refill(current.tokens(), current.lastRefillMillis(), nowMillis, limits);
            }
            boolean admitted = tokens >= 1.0;
            if (admitted) {
                tokens -= 1.0;
            }
            result.set(new ConsumeResult(admitted, tokens));
            return new BucketState(tokens, nowMillis, nowMillis + stateTtlMillis);
        });

        if (operations.incrementAndGet() % SWEEP_INTERVAL == 0) {
            evictExpired(now);
        }
        return result.get();
    }

    @Override
    public void ping() {
        // always reachable
    }

    /** Drops buckets whose TTL has passed. */
    public void evictExpired(Instant now) {
        long nowMillis = now.toEpochMilli();
        buckets.entrySet().removeIf(entry -> entry.getValue().isExpired(nowMillis));
    }

    public int size() {
        return buckets.size();
    }

    private record BucketState(double tokens, long lastRefillMillis, long expiresAtMillis) {

        boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAtMillis;
        }
    }
}
