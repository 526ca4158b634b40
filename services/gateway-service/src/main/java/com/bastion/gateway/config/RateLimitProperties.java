package com.bastion.gateway.config;

import com.bastion.ratelimit.DegradationPolicy;
import com.bastion.ratelimit.TierLimits;
import com.bastion.security.SubscriptionTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Rate-limit settings, bound from {@code bastion.rate-limit.*}.
 *
 * <pre>
 * bastion:
 *   rate-limit:
 *     store: redis
 *     degradation-policy: fail-open
 *     tiers:
 *       free: { requests-per-minute: 60, burst: 10 }
 * </pre>
 *
 * @param store             {@code in-memory} (single node) or {@code redis}
 * @param degradationPolicy what to do when the store is unavailable, defaults to fail-open
 * @param storeTimeout      bound on each store call (default 200ms)
 * @param stateTtl          idle lifetime of a bucket (default 60s)
 * @param tiers             per-tier budgets; unconfigured tiers keep their defaults
 */
@ConfigurationProperties(prefix = "bastion.rate-limit")
@Validated
public record RateLimitProperties(
        String store,
        DegradationPolicy degradationPolicy,
        Duration storeTimeout,
        Duration stateTtl,
        Map<SubscriptionTier, @Valid TierBudget> tiers) {

    public static final String STORE_IN_MEMORY = "in-memory";
    public static final String STORE_REDIS = "redis";

    public RateLimitProperties {
        if (store == null || store.isBlank()) {
            store = STORE_IN_MEMORY;
        }
        if (!STORE_IN_MEMORY.equals(store) && !STORE_REDIS.equals(store)) {
            throw new IllegalArgumentException("bastion.rate-limit.store must be 'in-memory' or 'redis', was: " + store);
        }
        if (degradationPolicy == null) {
            degradationPolicy = DegradationPolicy.FAIL_OPEN;
        }
        if (storeTimeout == null || storeTimeout.isNegative() || storeTimeout.isZero()) {
            storeTimeout = Duration.ofMillis(200);
        }
        if (stateTtl == null || stateTtl.isNegative() || stateTtl.isZero()) {
            stateTtl = Duration.ofSeconds(60);
        }
        tiers = tiers == null ? Map.of() : Map.copyOf(tiers);
    }

    public TierLimits toTierLimits() {
        TierLimits.Builder builder = TierLimits.builder();
        tiers.forEach((tier, budget) -> builder.tier(tier, budget.requestsPerMinute(), budget.burst()));
        return builder.withDefaults().build();
    }

    public record TierBudget(@Positive int requestsPerMinute, @Positive int burst) {
    }
}
