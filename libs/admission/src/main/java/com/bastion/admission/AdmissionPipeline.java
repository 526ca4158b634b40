package com.bastion.admission;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.observability.SpanHelper;
import com.bastion.ratelimit.RateLimitDecision;
import com.bastion.ratelimit.RateLimiter;
import com.bastion.security.AdmissionError;
import com.bastion.security.BearerTokenExtractor;
import com.bastion.security.ErrorCode;
import com.bastion.security.Identity;
import com.bastion.security.Outcome;
import com.bastion.security.TenantContext;
import com.bastion.security.TokenCodec;
import com.bastion.security.rbac.AuthorizationDecision;
import com.bastion.security.rbac.AuthorizationTarget;
import com.bastion.security.rbac.DenyReason;
import com.bastion.security.rbac.RbacAuthorizer;
import com.bastion.tenancy.TenantResolver;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Admits or rejects a request by running four stages in a fixed order:
 * <ol>
 *   <li>resolve the tenant from the request hints,</li>
 *   <li>charge one unit of the tenant's traffic budget,</li>
 *   <li>verify the bearer token against the resolved tenant,</li>
 *   <li>authorize the action for the verified identity.</li>
 * </ol>
 * The first failing stage ends the run and its error is the result. The budget charge is
 * final: a request that later fails verification or authorization still consumed its unit.
 * <p>
 * Each stage runs in its own span ({@code admission.<stage>}), every decision is counted under
 * {@code bastion.admission.decisions}, and rejections are logged as security events with
 * credentials redacted.
 */
public class AdmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(AdmissionPipeline.class);

    public static final String STAGE_TENANT = "admission.tenant";
    public static final String STAGE_RATE_LIMIT = "admission.rate_limit";
    public static final String STAGE_TOKEN = "admission.token";
    public static final String STAGE_AUTHORIZE = "admission.authorize";

    static final String METRIC_DECISIONS = "bastion.admission.decisions";
    static final String METRIC_DURATION = "bastion.admission.duration";

    private final TenantResolver tenantResolver;
    private final RateLimiter rateLimiter;
    private final TokenCodec tokenCodec;
    private final RbacAuthorizer authorizer;
    private final SpanHelper spans;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;

    public AdmissionPipeline(TenantResolver tenantResolver, RateLimiter rateLimiter, TokenCodec tokenCodec,
                             RbacAuthorizer authorizer, SpanHelper spans, MetricFactory metrics,
                             SensitiveDataRedactor redactor) {
        this.tenantResolver = tenantResolver;
        this.rateLimiter = rateLimiter;
        this.tokenCodec = tokenCodec;
        this.authorizer = authorizer;
        this.spans = spans;
        this.metrics = metrics;
        this.redactor = redactor;
    }

    public PipelineResult admit(AdmissionRequest request) {
        Timer.Sample sample = Timer.start(metrics.registry());
        String rawToken = BearerTokenExtractor.extract(request.authorizationHeader()).orElse(null);

        Outcome<AdmissionContext> outcome =
                stage(STAGE_TENANT, () -> tenantResolver.resolve(request.hints()))
                        .flatMap(tenant -> stage(STAGE_RATE_LIMIT, () -> chargeBudget(tenant)))
                        .flatMap(tenant -> stage(STAGE_TOKEN, () -> tokenCodec.verify(rawToken, tenant))
                                .map(identity -> new AdmissionContext(tenant, identity, request.action())))
                        .flatMap(context -> stage(STAGE_AUTHORIZE, () -> authorize(context, request.target())));

        PipelineResult result;
        if (outcome.isSuccess()) {
            AdmissionContext context = outcome.value();
            CorrelationContextHolder.update(ctx -> ctx.withPrincipal(context.tenantId(), context.subjectId()));
            log.debug("Admitted {} for subject {} in tenant {}",
                    request.action().value(), context.subjectId(), context.tenantId());
            count("admitted", "none");
            result = new PipelineResult.Admitted(context);
        } else {
            AdmissionError error = outcome.error();
            logRejection(request, error);
            count("rejected", error.code().name());
            result = new PipelineResult.Rejected(error);
        }
        sample.stop(metrics.timer(METRIC_DURATION, "Time spent admitting a request",
                "outcome", result.admitted() ? "admitted" : "rejected"));
        return result;
    }

    private <T> Outcome<T> stage(String name, Supplier<Outcome<T>> work) {
        return spans.inSpan(name, () -> {
            Outcome<T> outcome = work.get();
            SpanHelper.annotateCurrent("admission.result",
                    outcome.isSuccess() ? "ok" : outcome.error().code().name());
            return outcome;
        });
    }

    private Outcome<TenantContext> chargeBudget(TenantContext tenant) {
        RateLimitDecision decision = rateLimiter.admit(tenant);
        if (decision instanceof RateLimitDecision.Denied denied) {
            return Outcome.failure(AdmissionError.rateLimited(denied.retryAfter()));
        }
        return Outcome.success(tenant);
    }

    private Outcome<AdmissionContext> authorize(AdmissionContext context, AuthorizationTarget target) {
        Identity identity = context.identity();
        AuthorizationDecision decision = authorizer.authorize(identity, context.action(), target);
        if (decision.allowed()) {
            return Outcome.success(context);
        }
        if (decision.reason() == DenyReason.LAST_ADMIN) {
            return Outcome.failure(new AdmissionError(ErrorCode.LAST_ADMIN_VIOLATION,
                    decision.message(), decision.reason().name(), null));
        }
        return Outcome.failure(AdmissionError.forbidden(decision.reason().name(), decision.message()));
    }

    private void logRejection(AdmissionRequest request, AdmissionError error) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("code", error.code().name());
        if (error.reason() != null) {
            event.put("reason", error.reason());
        }
        event.put("action", request.action().value());
        event.put("tenantSlug", request.hints().slug());
        event.put("host", request.hints().host());
        event.put("tenantId", request.hints().tenantId());
        event.put("authorization", request.authorizationHeader());
        log.warn("security_event=admission_rejected {}", redactor.redact(event));
    }

    private void count(String outcome, String code) {
        metrics.counter(METRIC_DECISIONS, "Admission pipeline decisions", "outcome", outcome, "code", code)
                .increment();
    }
}
