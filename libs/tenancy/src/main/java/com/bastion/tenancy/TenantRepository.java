package com.bastion.tenancy;

import com.bastion.security.TenantContext;

import java.util.Optional;

/**
 * Tenant directory consulted by the resolver. Implementations return inactive tenants as well;
 * the resolver decides what inactive means for admission.
 */
public interface TenantRepository {

    Optional<TenantContext> findBySlug(String slug);

    Optional<TenantContext> findBySubdomain(String subdomain);

    Optional<TenantContext> findById(String tenantId);

    default Optional<TenantContext> find(TenantKey key) {
        return switch (key.kind()) {
            case SLUG -> findBySlug(key.value());
            case SUBDOMAIN -> findBySubdomain(key.value());
            case ID -> findById(key.value());
        };
    }
}
