package com.bastion.gateway.config;

import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tenant resolution settings, bound from {@code bastion.tenancy.*}.
 *
 * @param cacheTtl           lifetime of cached positive lookups (default 30s)
 * @param cacheMaxSize       maximum cached keys (default 10 000)
 * @param lookupTimeout      bound on each directory lookup (default 500ms)
 * @param reservedSubdomains host labels that never name a tenant (default www, api, app)
 */
@ConfigurationProperties(prefix = "bastion.tenancy")
public record TenancyProperties(
        Duration cacheTtl, Long cacheMaxSize, Duration lookupTimeout, Set<String> reservedSubdomains) {

    public TenancyProperties {
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            cacheTtl = Duration.ofSeconds(30);
        }
        if (cacheMaxSize == null || cacheMaxSize <= 0) {
            cacheMaxSize = 10_000L;
        }
        if (lookupTimeout == null || lookupTimeout.isNegative() || lookupTimeout.isZero()) {
            lookupTimeout = Duration.ofMillis(500);
        }
        if (reservedSubdomains == null || reservedSubdomains.isEmpty()) {
            reservedSubdomains = Set.of("www", "api", "app");
        }
    }
}
