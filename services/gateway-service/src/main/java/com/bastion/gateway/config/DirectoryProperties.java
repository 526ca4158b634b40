package com.bastion.gateway.config;

import com.bastion.security.Role;
import com.bastion.security.SubscriptionTier;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Seed data for the in-memory tenant and identity directories, bound from
 * {@code bastion.directory.*}. Provisioning happens outside the gateway; these seeds only
 * stand in for it on local runs and in tests.
 */
@ConfigurationProperties(prefix = "bastion.directory")
public record DirectoryProperties(List<SeedTenant> tenants, List<SeedIdentity> identities) {

    public DirectoryProperties {
        tenants = tenants == null ? List.of() : List.copyOf(tenants);
        identities = identities == null ? List.of() : List.copyOf(identities);
    }

    /**
     * @param requestsPerMinute optional rate override
     * @param burst             optional burst override
     */
    public record SeedTenant(
            String id,
            String slug,
            String subdomain,
            String name,
            Boolean active,
            SubscriptionTier tier,
            Integer requestsPerMinute,
            Integer burst) {
    }

    /**
     * @param tenant  slug of the tenant the identity belongs to
     * @param subject subject id
     * @param role    role in that tenant
     */
    public record SeedIdentity(String tenant, String subject, Role role) {
    }
}
