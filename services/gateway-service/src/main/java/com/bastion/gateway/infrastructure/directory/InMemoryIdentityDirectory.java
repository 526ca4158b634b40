package com.bastion.gateway.infrastructure.directory;

import com.bastion.security.Role;
import com.bastion.security.rbac.IdentityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed identity directory keyed by tenant and subject.
 * <p>
 * Removal re-checks the last-admin rule under the directory lock, so two concurrent deletions
 * cannot both pass an authorization check and leave a tenant without an admin.
 */
public class InMemoryIdentityDirectory implements IdentityRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityDirectory.class);

    public enum Removal {
        REMOVED,
        NOT_FOUND,
        LAST_ADMIN
    }

    private final Map<String, Map<String, Role>> identitiesByTenant = new ConcurrentHashMap<>();

    public synchronized void save(String tenantId, String subjectId, Role role) {
        if (tenantId == null || tenantId.isBlank() || subjectId == null || subjectId.isBlank() || role == null) {
            throw new IllegalArgumentException("tenantId, subjectId and role are required");
        }
        identitiesByTenant.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>()).put(subjectId, role);
    }

    public synchronized Removal remove(String tenantId, String subjectId) {
        Map<String, Role> members = identitiesByTenant.get(tenantId);
        Role role = members == null ? null : members.get(subjectId);
        if (role == null) {
            return Removal.NOT_FOUND;
        }
        if (role == Role.ADMIN && countAdminsInTenant(tenantId) <= 1) {
            return Removal.LAST_ADMIN;
        }
        members.remove(subjectId);
        log.info("Identity {} removed from tenant {}", subjectId, tenantId);
        return Removal.REMOVED;
    }

    @Override
    public int countAdminsInTenant(String tenantId) {
        Map<String, Role> members = identitiesByTenant.get(tenantId);
        if (members == null) {
            return 0;
        }
        return (int) members.values().stream().filter(role -> role == Role.ADMIN).count();
    }

    @Override
    public Optional<Role> findRole(String tenantId, String subjectId) {
        Map<String, Role> members = identitiesByTenant.get(tenantId);
        return members == null ? Optional.empty() : Optional.ofNullable(members.get(subjectId));
    }
}
