package com.bastion.tenancy;

import java.util.Locale;

/**
 * One lookup candidate: which unique attribute to match and the value to match it against.
 */
public record TenantKey(Kind kind, String value) {

    public enum Kind {
        SLUG,
        SUBDOMAIN,
        ID
    }

    public TenantKey {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be null or blank");
        }
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value;
    }
}
