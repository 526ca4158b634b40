package com.bastion.tenancy;

/**
 * Request data a tenant can be resolved from. Any component may be null.
 *
 * @param slug     value of the {@code X-Tenant-Slug} header
 * @param host     value of the {@code Host} header, possibly with a port
 * @param tenantId value of the {@code X-Tenant-Id} header
 */
public record TenantHints(String slug, String host, String tenantId) {

    public static TenantHints ofSlug(String slug) {
        return new TenantHints(slug, null, null);
    }

    public static TenantHints ofHost(String host) {
        return new TenantHints(null, host, null);
    }

    public static TenantHints ofTenantId(String tenantId) {
        return new TenantHints(null, null, tenantId);
    }

    public boolean isEmpty() {
        return isBlank(slug) && isBlank(host) && isBlank(tenantId);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
