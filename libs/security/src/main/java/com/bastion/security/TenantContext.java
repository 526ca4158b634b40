package com.bastion.security;

/**
 * A provisioned tenant as seen by the admission core.
 * <p>
 * Tenants are created and deactivated outside the core; this record is read-only here. The id,
 * slug and subdomain are each unique across tenants, so any of them identifies exactly one
 * context.
 *
 * @param tenantId          opaque unique key (UUID in the tenant directory)
 * @param slug              URL-safe unique name, matched against {@code X-Tenant-Slug}
 * @param subdomain         unique host label, matched against the request host
 * @param name              human-readable name
 * @param active            false once the tenant has been deactivated
 * @param tier              subscription tier selecting the default traffic budget
 * @param rateLimitOverride per-tenant budget override (never null, may be empty)
 */
public record TenantContext(
        String tenantId,
        String slug,
        String subdomain,
        String name,
        boolean active,
        SubscriptionTier tier,
        RateLimitOverride rateLimitOverride) {

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be null or blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier must not be null");
        }
        if (rateLimitOverride == null) {
            rateLimitOverride = RateLimitOverride.none();
        }
    }

    /** Premium features are available on the premium and enterprise tiers. */
    public boolean isPremium() {
        return tier == SubscriptionTier.PREMIUM || tier == SubscriptionTier.ENTERPRISE;
    }

    /** Returns a copy with {@code active = false}. */
    public TenantContext deactivated() {
        return new TenantContext(tenantId, slug, subdomain, name, false, tier, rateLimitOverride);
    }
}
