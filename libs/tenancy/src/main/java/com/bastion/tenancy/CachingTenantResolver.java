package com.bastion.tenancy;

import com.bastion.security.TenantContext;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link RepositoryTenantResolver} with a bounded, short-lived cache of positive lookups.
 * <p>
 * Only active tenants are cached; missing and inactive results always go back to the
 * repository. A stale active entry is the dangerous case, so the cache is invalidated on
 * deactivation events in addition to expiring after {@code ttl}. A lookup that was in flight
 * when an invalidation ran does not write its result back.
 */
public class CachingTenantResolver extends RepositoryTenantResolver implements TenantDeactivationListener {

    private static final Logger log = LoggerFactory.getLogger(CachingTenantResolver.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);
    public static final long DEFAULT_MAX_SIZE = 10_000;

    private final Cache<TenantKey, TenantContext> cache;
    private final Object invalidationLock = new Object();
    private long generation;

    public CachingTenantResolver(TenantRepository repository) {
        this(repository, new SubdomainParser(), DEFAULT_LOOKUP_TIMEOUT, DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }

    public CachingTenantResolver(TenantRepository repository, SubdomainParser subdomainParser,
                                 Duration lookupTimeout, Duration ttl, long maxSize) {
        this(repository, subdomainParser, lookupTimeout, ttl, maxSize, Ticker.systemTicker());
    }

    CachingTenantResolver(TenantRepository repository, SubdomainParser subdomainParser,
                          Duration lookupTimeout, Duration ttl, long maxSize, Ticker ticker) {
        super(repository, subdomainParser, lookupTimeout);
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    @Override
    protected Optional<TenantContext> lookup(TenantKey key) {
        TenantContext cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        long observed = currentGeneration();
        Optional<TenantContext> loaded = super.lookup(key);
        if (loaded.isPresent() && loaded.get().active()) {
            synchronized (invalidationLock) {
                if (generation == observed) {
                    cache.put(key, loaded.get());
                }
            }
        }
        return loaded;
    }

    /**
     * Drops every cached key that points at {@code tenantId}.
     */
    public void invalidate(String tenantId) {
        boolean removed;
        synchronized (invalidationLock) {
            generation++;
            removed = cache.asMap().values().removeIf(tenant -> tenant.tenantId().equals(tenantId));
        }
        if (removed) {
            log.info("Invalidated cached tenant {}", tenantId);
        }
    }

    public void invalidateAll() {
        synchronized (invalidationLock) {
            generation++;
            cache.invalidateAll();
        }
    }

    @Override
    public void onTenantDeactivated(String tenantId) {
        invalidate(tenantId);
    }

    private long currentGeneration() {
        synchronized (invalidationLock) {
            return generation;
        }
    }

    long cachedEntries() {
        cache.cleanUp();
        return cache.size();
    }
}
