package com.bastion.gateway.api;

import com.bastion.admission.AdmissionContext;
import com.bastion.gateway.infrastructure.web.AdmissionAction;
import com.bastion.security.TenantContext;
import com.bastion.security.rbac.Action;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Echoes the admitted tenant and caller, for clients checking which tenant a host or slug
 * resolves to.
 */
@RestController
@RequestMapping("/api/v1")
public class TenantContextController {

    @GetMapping("/context")
    @AdmissionAction(Action.TENANT_CONTEXT_VIEW)
    public Map<String, Object> context(AdmissionContext admission) {
        TenantContext tenant = admission.tenant();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenant.tenantId());
        body.put("slug", tenant.slug());
        body.put("name", tenant.name());
        body.put("tier", tenant.tier().value());
        body.put("subjectId", admission.subjectId());
        body.put("role", admission.identity().role().value());
        return body;
    }
}
