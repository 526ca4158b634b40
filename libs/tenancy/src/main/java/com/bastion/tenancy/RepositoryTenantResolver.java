package com.bastion.tenancy;

import com.bastion.security.ErrorCode;
import com.bastion.security.Outcome;
import com.bastion.security.TenantContext;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves tenants against a {@link TenantRepository}.
 * <p>
 * Candidates are tried in a fixed order: {@code X-Tenant-Slug} by slug, the host subdomain by
 * subdomain, {@code X-Tenant-Id} by id. The first candidate found decides the result; a miss
 * moves on to the next candidate. Every repository call is bounded by the lookup timeout and
 * runs on a bounded pool. A lookup that times out, fails or is rejected by the pool stops
 * resolution with {@code TENANT_NOT_FOUND}: a lower-priority hint never decides the tenant
 * while a higher-priority one is unanswered.
 */
public class RepositoryTenantResolver implements TenantResolver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RepositoryTenantResolver.class);

    public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_CONCURRENT_LOOKUPS = 64;

    private final TenantRepository repository;
    private final SubdomainParser subdomainParser;
    private final Duration lookupTimeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public RepositoryTenantResolver(TenantRepository repository) {
        this(repository, new SubdomainParser(), DEFAULT_LOOKUP_TIMEOUT);
    }

    public RepositoryTenantResolver(TenantRepository repository, SubdomainParser subdomainParser,
                                    Duration lookupTimeout) {
        this(repository, subdomainParser, lookupTimeout, defaultExecutor(), true);
    }

    public RepositoryTenantResolver(TenantRepository repository, SubdomainParser subdomainParser,
                                    Duration lookupTimeout, ExecutorService executor) {
        this(repository, subdomainParser, lookupTimeout, executor, false);
    }

    private RepositoryTenantResolver(TenantRepository repository, SubdomainParser subdomainParser,
                                     Duration lookupTimeout, ExecutorService executor, boolean ownsExecutor) {
        if (repository == null) {
            throw new IllegalArgumentException("repository must not be null");
        }
        if (lookupTimeout == null || lookupTimeout.isZero() || lookupTimeout.isNegative()) {
            throw new IllegalArgumentException("lookupTimeout must be positive");
        }
        this.repository = repository;
        this.subdomainParser = subdomainParser;
        this.lookupTimeout = lookupTimeout;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public Outcome<TenantContext> resolve(TenantHints hints) {
        if (hints == null || hints.isEmpty()) {
            log.warn("No tenant identifier in request");
            return Outcome.failure(ErrorCode.TENANT_NOT_FOUND,
                    "Tenant identifier required (subdomain, X-Tenant-Slug or X-Tenant-Id header)");
        }

        List<TenantKey> candidates = candidates(hints);
        for (TenantKey key : candidates) {
            Optional<TenantContext> found;
            try {
                found = lookup(key);
            } catch (TenantLookupUnavailableException e) {
                log.warn("Tenant lookup degraded, rejecting request: {}", e.getMessage());
                return Outcome.failure(ErrorCode.TENANT_NOT_FOUND, "Tenant could not be resolved");
            }
            if (found.isPresent()) {
                TenantContext tenant = found.get();
                if (!tenant.active()) {
                    log.warn("Inactive tenant attempted access: {}", key);
                    return Outcome.failure(ErrorCode.TENANT_INACTIVE, "Tenant account is inactive");
                }
                log.debug("Resolved tenant {} ({}) via {}", tenant.slug(), tenant.tenantId(), key.kind());
                return Outcome.success(tenant);
            }
        }

        log.warn("Tenant not found for candidates {}", candidates);
        return Outcome.failure(ErrorCode.TENANT_NOT_FOUND, "Tenant not found");
    }

    /**
     * Lookup candidates derived from the hints, in resolution order.
     */
    public List<TenantKey> candidates(TenantHints hints) {
        List<TenantKey> keys = new ArrayList<>(3);
        if (!TenantHints.isBlank(hints.slug())) {
            keys.add(new TenantKey(TenantKey.Kind.SLUG, hints.slug().strip()));
        }
        subdomainParser.parse(hints.host())
                .ifPresent(subdomain -> keys.add(new TenantKey(TenantKey.Kind.SUBDOMAIN, subdomain)));
        if (!TenantHints.isBlank(hints.tenantId())) {
            keys.add(new TenantKey(TenantKey.Kind.ID, hints.tenantId().strip()));
        }
        return keys;
    }

    /**
     * Looks up one candidate with the configured timeout.
     *
     * @return the tenant, or empty when the directory has no such key
     * @throws TenantLookupUnavailableException if the directory did not answer
     */
    protected Optional<TenantContext> lookup(TenantKey key) {
        CompletableFuture<Optional<TenantContext>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> repository.find(key), executor);
        } catch (RejectedExecutionException e) {
            throw new TenantLookupUnavailableException("lookup of " + key + " rejected, pool saturated", e);
        }
        try {
            return future.orTimeout(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw new TenantLookupUnavailableException(
                        "lookup of " + key + " timed out after " + lookupTimeout.toMillis() + " ms", cause);
            }
            throw new TenantLookupUnavailableException("lookup of " + key + " failed", cause);
        }
    }

    public Duration lookupTimeout() {
        return lookupTimeout;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    /**
     * Grows to {@link #DEFAULT_MAX_CONCURRENT_LOOKUPS} threads and rejects beyond that, so a
     * hung directory cannot pile up lookup threads.
     */
    private static ExecutorService defaultExecutor() {
        return new ThreadPoolExecutor(0, DEFAULT_MAX_CONCURRENT_LOOKUPS, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("tenant-lookup-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
