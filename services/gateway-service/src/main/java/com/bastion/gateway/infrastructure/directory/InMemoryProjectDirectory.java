package com.bastion.gateway.infrastructure.directory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Projects created through the gateway, keyed by id across all tenants. Lookups are not
 * tenant-filtered; callers check the owning tenant of what they load.
 */
@Component
public class InMemoryProjectDirectory {

    public record Project(String id, String tenantId, String ownerId, String name) {
    }

    private final Map<String, Project> projects = new ConcurrentHashMap<>();

    public Project create(String tenantId, String ownerId, String name) {
        Project project = new Project(UUID.randomUUID().toString(), tenantId, ownerId, name);
        projects.put(project.id(), project);
        return project;
    }

    public Optional<Project> findById(String projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }
}
