package com.bastion.tenancy;

import com.bastion.security.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Map-backed tenant directory for local runs and tests.
 * <p>
 * Enforces slug and subdomain uniqueness on save and publishes deactivation events to
 * registered {@link TenantDeactivationListener}s.
 */
public class InMemoryTenantRepository implements TenantRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTenantRepository.class);

    private final Map<String, TenantContext> tenants = new ConcurrentHashMap<>();
    private final List<TenantDeactivationListener> listeners = new CopyOnWriteArrayList<>();

    public synchronized void save(TenantContext tenant) {
        for (TenantContext existing : tenants.values()) {
            if (existing.tenantId().equals(tenant.tenantId())) {
                continue;
            }
            if (existing.slug().equals(tenant.slug())) {
                throw new IllegalArgumentException("Slug already in use: " + tenant.slug());
            }
            if (tenant.subdomain() != null && tenant.subdomain().equals(existing.subdomain())) {
                throw new IllegalArgumentException("Subdomain already in use: " + tenant.subdomain());
            }
        }
        tenants.put(tenant.tenantId(), tenant);
    }

    /**
     * Marks the tenant inactive and notifies listeners.
     *
     * @return false if the tenant is unknown
     */
    public boolean deactivate(String tenantId) {
        TenantContext updated = tenants.computeIfPresent(tenantId, (id, tenant) -> tenant.deactivated());
        if (updated == null) {
            return false;
        }
        log.info("Tenant {} deactivated", tenantId);
        listeners.forEach(listener -> listener.onTenantDeactivated(tenantId));
        return true;
    }

    public void addDeactivationListener(TenantDeactivationListener listener) {
        listeners.add(listener);
    }

    public Collection<TenantContext> findAll() {
        return List.copyOf(tenants.values());
    }

    @Override
    public Optional<TenantContext> findBySlug(String slug) {
        return findFirst(tenant -> tenant.slug().equals(slug));
    }

    @Override
    public Optional<TenantContext> findBySubdomain(String subdomain) {
        return findFirst(tenant -> subdomain.equals(tenant.subdomain()));
    }

    @Override
    public Optional<TenantContext> findById(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    private Optional<TenantContext> findFirst(Predicate<TenantContext> predicate) {
        return tenants.values().stream().filter(predicate).findFirst();
    }
}
