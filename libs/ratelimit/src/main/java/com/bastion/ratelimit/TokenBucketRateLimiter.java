package com.bastion.ratelimit;

import com.bastion.observability.MetricFactory;
import com.bastion.security.TenantContext;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Token bucket {@link RateLimiter} over a shared {@link RateLimitStore}.
 * <p>
 * Limits come from {@link TierLimits} with the tenant's override applied. Each store call is
 * bounded by {@code storeTimeout} and runs on a pool of at most {@code maxConcurrentStoreCalls}
 * threads. A timeout, a store failure or a saturated pool is resolved by the
 * {@link DegradationPolicy} at this one place and nowhere else.
 */
public class TokenBucketRateLimiter implements RateLimiter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    public static final Duration DEFAULT_STORE_TIMEOUT = Duration.ofMillis(200);
    public static final Duration FAIL_CLOSED_RETRY_AFTER = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_CONCURRENT_STORE_CALLS = 64;

    static final String METRIC_DECISIONS = "bastion.ratelimit.decisions";

    private final RateLimitStore store;
    private final TierLimits tierLimits;
    private final DegradationPolicy degradationPolicy;
    private final Duration storeTimeout;
    private final Clock clock;
    private final MetricFactory metrics;
    private final ExecutorService executor;

    public TokenBucketRateLimiter(RateLimitStore store, TierLimits tierLimits, DegradationPolicy degradationPolicy,
                                  Duration storeTimeout, Clock clock, MetricFactory metrics) {
        this(store, tierLimits, degradationPolicy, storeTimeout, clock, metrics, DEFAULT_MAX_CONCURRENT_STORE_CALLS);
    }

    TokenBucketRateLimiter(RateLimitStore store, TierLimits tierLimits, DegradationPolicy degradationPolicy,
                           Duration storeTimeout, Clock clock, MetricFactory metrics, int maxConcurrentStoreCalls) {
        if (store == null || tierLimits == null || degradationPolicy == null || clock == null) {
            throw new IllegalArgumentException("store, tierLimits, degradationPolicy and clock are required");
        }
        if (storeTimeout == null || storeTimeout.isZero() || storeTimeout.isNegative()) {
            throw new IllegalArgumentException("storeTimeout must be positive");
        }
        this.store = store;
        this.tierLimits = tierLimits;
        this.degradationPolicy = degradationPolicy;
        this.storeTimeout = storeTimeout;
        this.clock = clock;
        this.metrics = metrics;
        this.executor = new ThreadPoolExecutor(0, maxConcurrentStoreCalls, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("rate-limit-store-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public RateLimitDecision admit(TenantContext tenant) {
        BucketLimits limits = tierLimits.limitsFor(tenant);
        Instant now = clock.instant();

        ConsumeResult result;
        try {
            result = consume(tenant.tenantId(), limits, now);
        } catch (RateLimitStoreUnavailableException e) {
            return degrade(tenant, e);
        }

        if (result.admitted()) {
            record("admitted");
            return new RateLimitDecision.Admitted((long) Math.floor(result.tokens()), false);
        }
        Duration retryAfter = retryAfter(result.tokens(), limits);
        record("denied");
        log.debug("Rate limit exceeded for tenant {}, retry after {} ms", tenant.tenantId(), retryAfter.toMillis());
        return new RateLimitDecision.Denied(retryAfter, false);
    }

    /**
     * Time until the bucket holds one whole token: {@code (1 - tokens) / rate}.
     */
    static Duration retryAfter(double tokens, BucketLimits limits) {
        double seconds = Math.max(0.0, 1.0 - tokens) / limits.ratePerSecond();
        return Duration.ofNanos((long) Math.ceil(seconds * 1_000_000_000L));
    }

    public DegradationPolicy degradationPolicy() {
        return degradationPolicy;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ConsumeResult consume(String key, BucketLimits limits, Instant now) {
        CompletableFuture<ConsumeResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> store.refillAndDecrement(key, limits, now), executor);
        } catch (RejectedExecutionException e) {
            throw new RateLimitStoreUnavailableException("Rate-limit store calls saturated", e);
        }
        try {
            return future.orTimeout(storeTimeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RateLimitStoreUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof TimeoutException) {
                throw new RateLimitStoreUnavailableException(
                        "Rate-limit store timed out after " + storeTimeout.toMillis() + " ms", cause);
            }
            throw new RateLimitStoreUnavailableException("Rate-limit store failed", cause);
        }
    }

    private RateLimitDecision degrade(TenantContext tenant, RateLimitStoreUnavailableException e) {
        record("degraded");
        if (degradationPolicy == DegradationPolicy.FAIL_OPEN) {
            log.warn("Rate-limit store unavailable, admitting tenant {} unchecked (fail-open): {}",
                    tenant.tenantId(), e.getMessage());
            return new RateLimitDecision.Admitted(-1, true);
        }
        log.warn("Rate-limit store unavailable, denying tenant {} (fail-closed): {}",
                tenant.tenantId(), e.getMessage());
        return new RateLimitDecision.Denied(FAIL_CLOSED_RETRY_AFTER, true);
    }

    private void record(String outcome) {
        if (metrics != null) {
            metrics.counter(METRIC_DECISIONS, "Rate-limit admission decisions", "outcome", outcome).increment();
        }
    }
}
