package com.bastion.gateway.config;

import com.bastion.admission.AdmissionPipeline;
import com.bastion.gateway.infrastructure.directory.InMemoryIdentityDirectory;
import com.bastion.observability.HealthCheckRegistry;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.observability.SpanHelper;
import com.bastion.ratelimit.InMemoryRateLimitStore;
import com.bastion.ratelimit.RateLimitStore;
import com.bastion.ratelimit.RateLimitStoreHealthCheck;
import com.bastion.ratelimit.RedisRateLimitStore;
import com.bastion.ratelimit.TokenBucketRateLimiter;
import com.bastion.security.JwtTokenCodec;
import com.bastion.security.RateLimitOverride;
import com.bastion.security.SubscriptionTier;
import com.bastion.security.TenantContext;
import com.bastion.security.TokenCodec;
import com.bastion.security.rbac.RbacAuthorizer;
import com.bastion.tenancy.CachingTenantResolver;
import com.bastion.tenancy.InMemoryTenantRepository;
import com.bastion.tenancy.SubdomainParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the admission pipeline from the Bastion libraries.
 */
@Configuration
public class AdmissionConfig {

    private static final Logger log = LoggerFactory.getLogger(AdmissionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("bastion-" + service.name()));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public InMemoryTenantRepository tenantRepository(DirectoryProperties directory) {
        InMemoryTenantRepository repository = new InMemoryTenantRepository();
        for (DirectoryProperties.SeedTenant seed : directory.tenants()) {
            String slug = Objects.requireNonNull(seed.slug(), "seed tenant slug");
            repository.save(new TenantContext(
                    seed.id(),
                    slug,
                    seed.subdomain() == null ? slug : seed.subdomain(),
                    seed.name() == null ? slug : seed.name(),
                    seed.active() == null || seed.active(),
                    seed.tier() == null ? SubscriptionTier.FREE : seed.tier(),
                    new RateLimitOverride(seed.requestsPerMinute(), seed.burst())));
        }
        log.info("Seeded {} tenants", directory.tenants().size());
        return repository;
    }

    @Bean(destroyMethod = "close")
    public CachingTenantResolver tenantResolver(InMemoryTenantRepository repository, TenancyProperties tenancy) {
        CachingTenantResolver resolver = new CachingTenantResolver(
                repository,
                new SubdomainParser(tenancy.reservedSubdomains()),
                tenancy.lookupTimeout(),
                tenancy.cacheTtl(),
                tenancy.cacheMaxSize());
        repository.addDeactivationListener(resolver);
        return resolver;
    }

    @Bean
    public TokenCodec tokenCodec(TokenProperties token, Clock clock) {
        return new JwtTokenCodec(token.secret(), token.validity(), token.issuer(), clock);
    }

    @Bean
    public InMemoryIdentityDirectory identityDirectory(DirectoryProperties directory,
                                                       InMemoryTenantRepository tenants) {
        InMemoryIdentityDirectory identities = new InMemoryIdentityDirectory();
        for (DirectoryProperties.SeedIdentity seed : directory.identities()) {
            TenantContext tenant = tenants.findBySlug(seed.tenant())
                    .orElseThrow(() -> new IllegalStateException("Seed identity references unknown tenant: " + seed.tenant()));
            identities.save(tenant.tenantId(), seed.subject(), seed.role());
        }
        return identities;
    }

    @Bean
    public RbacAuthorizer rbacAuthorizer(InMemoryIdentityDirectory identities) {
        return new RbacAuthorizer(identities);
    }

    @Bean
    @ConditionalOnProperty(prefix = "bastion.rate-limit", name = "store", havingValue = "in-memory", matchIfMissing = true)
    public RateLimitStore inMemoryRateLimitStore(RateLimitProperties rateLimit) {
        log.info("Using in-memory rate limit store; limits are per node");
        return new InMemoryRateLimitStore(rateLimit.stateTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "bastion.rate-limit", name = "store", havingValue = "redis")
    public RateLimitStore redisRateLimitStore(StringRedisTemplate redisTemplate, RateLimitProperties rateLimit) {
        log.info("Using Redis rate limit store");
        return new RedisRateLimitStore(redisTemplate, rateLimit.stateTtl());
    }

    @Bean(destroyMethod = "close")
    public TokenBucketRateLimiter rateLimiter(RateLimitStore store, RateLimitProperties rateLimit,
                                              Clock clock, MetricFactory metrics) {
        return new TokenBucketRateLimiter(store, rateLimit.toTierLimits(), rateLimit.degradationPolicy(),
                rateLimit.storeTimeout(), clock, metrics);
    }

    @Bean
    public AdmissionPipeline admissionPipeline(CachingTenantResolver tenantResolver, TokenBucketRateLimiter rateLimiter,
                                               TokenCodec tokenCodec, RbacAuthorizer authorizer, SpanHelper spans,
                                               MetricFactory metrics, SensitiveDataRedactor redactor) {
        return new AdmissionPipeline(tenantResolver, rateLimiter, tokenCodec, authorizer, spans, metrics, redactor);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(RateLimitStore store) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(RateLimitStoreHealthCheck.NAME, new RateLimitStoreHealthCheck(store));
        return registry;
    }
}
