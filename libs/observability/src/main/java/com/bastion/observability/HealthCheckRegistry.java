package com.bastion.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs every registered {@link HealthCheck} concurrently and folds the results into one
 * {@link HealthResult}. A probe that does not answer within the timeout counts as UNHEALTHY.
 */
public final class HealthCheckRegistry {

    public static final long DEFAULT_TIMEOUT_MS = 2000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers {@code check} under {@code name}, replacing any previous check of that name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public HealthResult checkAll() {
        if (checks.isEmpty()) {
            return new HealthResult(HealthStatus.HEALTHY, Map.of(), Instant.now());
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        checks.forEach((name, check) -> futures.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            results.put(name, result);
            overall = worst(overall, result.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ComponentHealth.unhealthy(name, e.getMessage(), 0));
        }
    }

    private static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
