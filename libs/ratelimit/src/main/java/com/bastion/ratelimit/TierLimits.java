package com.bastion.ratelimit;

import com.bastion.security.RateLimitOverride;
import com.bastion.security.SubscriptionTier;
import com.bastion.security.TenantContext;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default traffic budget per subscription tier, in requests per minute and burst.
 * <p>
 * A tenant's {@link RateLimitOverride} replaces the tier default one component at a time: an
 * override that only sets the burst keeps the tier's rate.
 */
public final class TierLimits {

    private final Map<SubscriptionTier, Budget> budgets;

    private TierLimits(Map<SubscriptionTier, Budget> budgets) {
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            if (!budgets.containsKey(tier)) {
                throw new IllegalArgumentException("No budget configured for tier " + tier);
            }
        }
        this.budgets = Collections.unmodifiableMap(new EnumMap<>(budgets));
    }

    /** FREE 60/10, BASIC 120/20, PREMIUM 600/100, ENTERPRISE 3000/500. */
    public static TierLimits defaults() {
        return builder()
                .tier(SubscriptionTier.FREE, 60, 10)
                .tier(SubscriptionTier.BASIC, 120, 20)
                .tier(SubscriptionTier.PREMIUM, 600, 100)
                .tier(SubscriptionTier.ENTERPRISE, 3000, 500)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BucketLimits limitsFor(TenantContext tenant) {
        Budget budget = budgets.get(tenant.tier());
        RateLimitOverride override = tenant.rateLimitOverride();
        int requestsPerMinute = override.requestsPerMinute() != null
                ? override.requestsPerMinute()
                : budget.requestsPerMinute();
        int burst = override.burst() != null ? override.burst() : budget.burst();
        return BucketLimits.perMinute(requestsPerMinute, burst);
    }

    public int requestsPerMinute(SubscriptionTier tier) {
        return budgets.get(tier).requestsPerMinute();
    }

    public int burst(SubscriptionTier tier) {
        return budgets.get(tier).burst();
    }

    private record Budget(int requestsPerMinute, int burst) {

        private Budget {
            if (requestsPerMinute <= 0 || burst <= 0) {
                throw new IllegalArgumentException("requestsPerMinute and burst must be positive");
            }
        }
    }

    public static final class Builder {

        private final Map<SubscriptionTier, Budget> budgets = new EnumMap<>(SubscriptionTier.class);

        private Builder() {
        }

        public Builder tier(SubscriptionTier tier, int requestsPerMinute, int burst) {
            budgets.put(tier, new Budget(requestsPerMinute, burst));
            return this;
        }

        /** Starts from {@link #defaults()} so callers only override what they configure. */
        public Builder withDefaults() {
            TierLimits defaults = defaults();
            for (SubscriptionTier tier : SubscriptionTier.values()) {
                budgets.putIfAbsent(tier, defaults.budgets.get(tier));
            }
            return this;
        }

        public TierLimits build() {
            return new TierLimits(budgets);
        }
    }
}
