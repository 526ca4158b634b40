package com.bastion.gateway.infrastructure.health;

import com.bastion.observability.ComponentHealth;
import com.bastion.observability.HealthCheckRegistry;
import com.bastion.observability.HealthResult;
import com.bastion.observability.HealthStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the admission dependencies through {@code /actuator/health}. A degraded component
 * keeps the gateway UP (admission still answers under its degradation policy) and is reported
 * in the details; an unhealthy one takes it DOWN.
 */
@Component("admission")
public class AdmissionHealthIndicator implements HealthIndicator {

    private final HealthCheckRegistry registry;

    public AdmissionHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthResult result = registry.checkAll();
        Health.Builder builder = result.status() == HealthStatus.UNHEALTHY ? Health.down() : Health.up();
        builder.withDetail("status", result.status().name());
        for (ComponentHealth component : result.checks().values()) {
            builder.withDetail(component.name(), component.message() == null
                    ? component.status().name()
                    : component.status().name() + ": " + component.message());
        }
        return builder.build();
    }
}
