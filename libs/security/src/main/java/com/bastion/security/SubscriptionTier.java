package com.bastion.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription tiers. The tier selects a tenant's default traffic budget when the tenant has
 * no explicit rate-limit override.
 */
public enum SubscriptionTier {

    FREE("free"),
    BASIC("basic"),
    PREMIUM("premium"),
    ENTERPRISE("enterprise");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SubscriptionTier> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (SubscriptionTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
