package com.bastion.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.bastion.observability.MetricFactory;
import com.bastion.security.TenantContext;
import com.bastion.security.testing.MutableClock;
import com.bastion.security.testing.TestTenants;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TokenBucketRateLimiter")
class TokenBucketRateLimiterTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private MetricFactory metrics;
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-15T10:00:00Z");
        registry = new SimpleMeterRegistry();
        metrics = new MetricFactory(registry, "test-service");
        limiter = limiter(new InMemoryRateLimitStore(), DegradationPolicy.FAIL_OPEN);
    }

    @AfterEach
    void tearDown() {
        limiter.close();
    }

    @Nested
    @DisplayName("token bucket")
    class Bucket {

        @Test
        @DisplayName("burst 10 at 1/s admits 10, denies the 11th, then admits exactly one after a second")
        void burstThenRefill() {
            TenantContext acme = TestTenants.acme();

            for (int i = 0; i < 10; i++) {
                assertThat(limiter.admit(acme).admitted()).as("request %d", i + 1).isTrue();
            }

            RateLimitDecision eleventh = limiter.admit(acme);
            assertThat(eleventh).isInstanceOf(RateLimitDecision.Denied.class);
            assertThat(((RateLimitDecision.Denied) eleventh).retryAfter().toMillis())
                    .isCloseTo(1000L, within(1L));

            clock.advance(Duration.ofSeconds(1));
            assertThat(limiter.admit(acme).admitted()).isTrue();
            assertThat(limiter.admit(acme).admitted()).isFalse();
        }

        @Test
        @DisplayName("reports the whole tokens remaining")
        void remaining() {
            RateLimitDecision first = limiter.admit(TestTenants.acme());

            assertThat(first).isEqualTo(new RateLimitDecision.Admitted(9, false));
        }

        @Test
        @DisplayName("a partially refilled bucket shortens the retry hint")
        void partialRetryAfter() {
            TenantContext acme = TestTenants.acme();
            for (int i = 0; i < 10; i++) {
                limiter.admit(acme);
            }
            clock.advance(Duration.ofMillis(400));

            RateLimitDecision.Denied denied = (RateLimitDecision.Denied) limiter.admit(acme);
            assertThat(denied.retryAfter().toMillis()).isCloseTo(600L, within(1L));
        }

        @Test
        @DisplayName("the tenant override wins over the tier default")
        void override() {
            TenantContext tight = TestTenants.withOverride(TestTenants.acme(), 60, 2);

            assertThat(limiter.admit(tight).admitted()).isTrue();
            assertThat(limiter.admit(tight).admitted()).isTrue();
            assertThat(limiter.admit(tight).admitted()).isFalse();
        }

        @Test
        @DisplayName("tenants do not share budgets")
        void perTenant() {
            TenantContext acme = TestTenants.withOverride(TestTenants.acme(), 60, 1);
            TenantContext beta = TestTenants.withOverride(TestTenants.beta(), 60, 1);

            assertThat(limiter.admit(acme).admitted()).isTrue();
            assertThat(limiter.admit(acme).admitted()).isFalse();
            assertThat(limiter.admit(beta).admitted()).isTrue();
        }

        @Test
        @DisplayName("concurrent checks against a one-token bucket admit exactly one")
        void concurrent() throws Exception {
            TenantContext single = TestTenants.withOverride(TestTenants.acme(), 1, 1);
            int callers = 24;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<RateLimitDecision>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return limiter.admit(single);
                    }));
                }
                start.countDown();

                long admitted = 0;
                for (Future<RateLimitDecision> future : futures) {
                    if (future.get().admitted()) {
                        admitted++;
                    }
                }
                assertThat(admitted).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("degradation")
    class Degradation {

        @Test
        @DisplayName("fail-open admits when the store throws")
        void failOpen() {
            RateLimitStore broken = mock(RateLimitStore.class);
            when(broken.refillAndDecrement(anyString(), any(BucketLimits.class), any(Instant.class)))
                    .thenThrow(new RateLimitStoreUnavailableException("connection refused"));

            try (TokenBucketRateLimiter open = limiter(broken, DegradationPolicy.FAIL_OPEN)) {
                RateLimitDecision decision = open.admit(TestTenants.acme());

                assertThat(decision.admitted()).isTrue();
                assertThat(decision.degraded()).isTrue();
            }
        }

        @Test
        @DisplayName("fail-closed denies with a one second hint when the store throws")
        void failClosed() {
            RateLimitStore broken = mock(RateLimitStore.class);
            when(broken.refillAndDecrement(anyString(), any(BucketLimits.class), any(Instant.class)))
                    .thenThrow(new IllegalStateException("unexpected"));

            try (TokenBucketRateLimiter closed = limiter(broken, DegradationPolicy.FAIL_CLOSED)) {
                RateLimitDecision decision = closed.admit(TestTenants.acme());

                assertThat(decision).isEqualTo(new RateLimitDecision.Denied(Duration.ofSeconds(1), true));
            }
        }

        @Test
        @DisplayName("a store call exceeding the timeout is treated as unavailable")
        void timeout() {
            RateLimitStore slow = new RateLimitStore() {
                @Override
                public ConsumeResult refillAndDecrement(String key, BucketLimits limits, Instant now) {
                    try {
                        Thread.sleep(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new ConsumeResult(true, 1);
                }

                @Override
                public void ping() {
                }
            };

            try (TokenBucketRateLimiter closed = limiter(slow, DegradationPolicy.FAIL_CLOSED, Duration.ofMillis(100))) {
                long start = System.nanoTime();
                RateLimitDecision decision = closed.admit(TestTenants.acme());

                assertThat(decision.admitted()).isFalse();
                assertThat(decision.degraded()).isTrue();
                assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
            }
        }

        @Test
        @DisplayName("a saturated store pool is treated as unavailable")
        void saturated() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            RateLimitStore blocking = new RateLimitStore() {
                @Override
                public ConsumeResult refillAndDecrement(String key, BucketLimits limits, Instant now) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new ConsumeResult(true, 1);
                }

                @Override
                public void ping() {
                }
            };

            try (TokenBucketRateLimiter bounded = new TokenBucketRateLimiter(blocking, TierLimits.defaults(),
                    DegradationPolicy.FAIL_CLOSED, Duration.ofSeconds(5), clock, metrics, 1)) {
                CompletableFuture<RateLimitDecision> first =
                        CompletableFuture.supplyAsync(() -> bounded.admit(TestTenants.acme()));
                assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

                RateLimitDecision second = bounded.admit(TestTenants.beta());
                release.countDown();

                assertThat(second).isEqualTo(new RateLimitDecision.Denied(Duration.ofSeconds(1), true));
                assertThat(first.get(5, TimeUnit.SECONDS).degraded()).isFalse();
            } finally {
                release.countDown();
            }
        }
    }

    @Test
    @DisplayName("counts decisions by outcome")
    void metrics() {
        TenantContext single = TestTenants.withOverride(TestTenants.acme(), 60, 1);
        limiter.admit(single);
        limiter.admit(single);
        limiter.admit(single);

        assertThat(registry.get(TokenBucketRateLimiter.METRIC_DECISIONS).tag("outcome", "admitted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get(TokenBucketRateLimiter.METRIC_DECISIONS).tag("outcome", "denied").counter().count())
                .isEqualTo(2.0);
    }

    private TokenBucketRateLimiter limiter(RateLimitStore store, DegradationPolicy policy) {
        return limiter(store, policy, Duration.ofSeconds(2));
    }

    private TokenBucketRateLimiter limiter(RateLimitStore store, DegradationPolicy policy, Duration storeTimeout) {
        return new TokenBucketRateLimiter(store, TierLimits.defaults(), policy, storeTimeout, clock, metrics);
    }
}
