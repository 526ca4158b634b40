package com.bastion.gateway.infrastructure.web;

import com.bastion.admission.AdmissionPipeline;
import com.bastion.admission.AdmissionRequest;
import com.bastion.admission.PipelineResult;
import com.bastion.security.rbac.AuthorizationTarget;
import com.bastion.tenancy.TenantHints;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Runs the admission pipeline for handlers annotated with {@link AdmissionAction}.
 *
 * <p>Tenant hints come from {@code X-Tenant-Slug}, {@code Host} and {@code X-Tenant-Id}. An
 * admitted request carries its {@link com.bastion.admission.AdmissionContext} as the
 * {@link #CONTEXT_ATTRIBUTE} request attribute; a rejected one never reaches the handler.
 */
public class AdmissionInterceptor implements HandlerInterceptor {

    public static final String TENANT_SLUG_HEADER = "X-Tenant-Slug";
    public static final String TENANT_ID_HEADER = "X-Tenant-Id";
    public static final String CONTEXT_ATTRIBUTE = AdmissionInterceptor.class.getName() + ".CONTEXT";

    private final AdmissionPipeline pipeline;

    public AdmissionInterceptor(AdmissionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        AdmissionAction annotation = method.getMethodAnnotation(AdmissionAction.class);
        if (annotation == null) {
            return true;
        }

        TenantHints hints = new TenantHints(
                request.getHeader(TENANT_SLUG_HEADER),
                request.getHeader(HttpHeaders.HOST),
                request.getHeader(TENANT_ID_HEADER));
        AdmissionRequest admissionRequest = new AdmissionRequest(
                hints,
                request.getHeader(HttpHeaders.AUTHORIZATION),
                annotation.value(),
                target(request, annotation.ownerPathVariable()));

        PipelineResult result = pipeline.admit(admissionRequest);
        if (result instanceof PipelineResult.Rejected rejected) {
            throw new AdmissionRejectedException(rejected.error());
        }
        request.setAttribute(CONTEXT_ATTRIBUTE, ((PipelineResult.Admitted) result).context());
        return true;
    }

    private static AuthorizationTarget target(HttpServletRequest request, String ownerPathVariable) {
        if (ownerPathVariable.isEmpty()) {
            return AuthorizationTarget.none();
        }
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (attribute instanceof Map<?, ?> variables && variables.get(ownerPathVariable) instanceof String owner) {
            return AuthorizationTarget.ownedBy(owner);
        }
        return AuthorizationTarget.none();
    }
}
