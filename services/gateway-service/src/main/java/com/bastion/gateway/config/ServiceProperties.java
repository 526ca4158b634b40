package com.bastion.gateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code bastion.service.*}.
 *
 * <pre>
 * bastion:
 *   service:
 *     name: gateway-service
 *     environment: production
 * </pre>
 *
 * @param name        service name used in logs, metric tags and traces; required
 * @param environment deployment environment, defaults to {@code development}
 */
@ConfigurationProperties(prefix = "bastion.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
