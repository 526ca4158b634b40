package com.bastion.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.bastion.security.SubscriptionTier;
import com.bastion.security.TenantContext;
import com.bastion.security.testing.TestTenants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TierLimits")
class TierLimitsTest {

    private final TierLimits limits = TierLimits.defaults();

    @Test
    @DisplayName("FREE tier defaults to 60 requests per minute with a burst of 10")
    void freeDefaults() {
        BucketLimits bucket = limits.limitsFor(TestTenants.acme());

        assertThat(bucket.ratePerSecond()).isCloseTo(1.0, within(1e-9));
        assertThat(bucket.burst()).isEqualTo(10);
    }

    @Test
    @DisplayName("higher tiers get larger budgets")
    void tiers() {
        assertThat(limits.limitsFor(TestTenants.withTier(TestTenants.acme(), SubscriptionTier.PREMIUM)).burst())
                .isEqualTo(100);
        assertThat(limits.limitsFor(TestTenants.withTier(TestTenants.acme(), SubscriptionTier.ENTERPRISE))
                .requestsPerMinute()).isCloseTo(3000.0, within(1e-6));
    }

    @Test
    @DisplayName("override components replace tier defaults independently")
    void partialOverride() {
        TenantContext burstOnly = TestTenants.withOverride(TestTenants.acme(), null, 3);
        TenantContext rateOnly = TestTenants.withOverride(TestTenants.acme(), 120, null);

        assertThat(limits.limitsFor(burstOnly).burst()).isEqualTo(3);
        assertThat(limits.limitsFor(burstOnly).ratePerSecond()).isCloseTo(1.0, within(1e-9));
        assertThat(limits.limitsFor(rateOnly).burst()).isEqualTo(10);
        assertThat(limits.limitsFor(rateOnly).ratePerSecond()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("builder with defaults only replaces the configured tiers")
    void builder() {
        TierLimits custom = TierLimits.builder().tier(SubscriptionTier.BASIC, 30, 5).withDefaults().build();

        assertThat(custom.requestsPerMinute(SubscriptionTier.BASIC)).isEqualTo(30);
        assertThat(custom.burst(SubscriptionTier.FREE)).isEqualTo(10);
    }

    @Test
    @DisplayName("every tier must have a budget")
    void incomplete() {
        assertThatThrownBy(() -> TierLimits.builder().tier(SubscriptionTier.FREE, 60, 10).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BASIC");
    }
}
