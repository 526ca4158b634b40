package com.bastion.ratelimit;

import com.bastion.observability.ComponentHealth;
import com.bastion.observability.HealthCheck;

import java.util.concurrent.CompletableFuture;

/**
 * Pings the rate-limit store. An unreachable store reports DEGRADED; the limiter keeps serving
 * under its degradation policy.
 */
public class RateLimitStoreHealthCheck implements HealthCheck {

    public static final String NAME = "rate-limit-store";

    private final RateLimitStore store;

    public RateLimitStoreHealthCheck(RateLimitStore store) {
        this.store = store;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            try {
                store.ping();
                return ComponentHealth.healthy(NAME, elapsedMillis(start));
            } catch (RateLimitStoreUnavailableException e) {
                return ComponentHealth.degraded(NAME, e.getMessage(), elapsedMillis(start));
            }
        });
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
