package com.bastion.gateway.api;

import com.bastion.admission.AdmissionContext;
import com.bastion.gateway.infrastructure.directory.InMemoryProjectDirectory;
import com.bastion.gateway.infrastructure.directory.InMemoryProjectDirectory.Project;
import com.bastion.gateway.infrastructure.web.AdmissionAction;
import com.bastion.security.TenantIsolationEnforcer;
import com.bastion.security.rbac.Action;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final InMemoryProjectDirectory projects;

    public ProjectController(InMemoryProjectDirectory projects) {
        this.projects = projects;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @AdmissionAction(Action.PROJECT_CREATE)
    public Project create(AdmissionContext admission, @Valid @RequestBody CreateProjectRequest request) {
        Project project = projects.create(admission.tenantId(), admission.subjectId(), request.name());
        log.info("Project {} created", project.id());
        return project;
    }

    /**
     * Project ids are global, so a caller can name another tenant's project; that is a
     * TENANT_MISMATCH, not a not-found.
     */
    @GetMapping("/{projectId}")
    @AdmissionAction(Action.PROJECT_VIEW)
    public ResponseEntity<Project> get(AdmissionContext admission, @PathVariable String projectId) {
        return projects.findById(projectId)
                .map(project -> {
                    TenantIsolationEnforcer.enforce(admission.identity(), project.tenantId());
                    return ResponseEntity.ok(project);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
