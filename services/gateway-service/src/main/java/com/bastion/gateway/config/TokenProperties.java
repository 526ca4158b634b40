package com.bastion.gateway.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity token settings, bound from {@code bastion.token.*}.
 *
 * @param secret   HS256 shared secret; required, supply it through the environment in production
 * @param validity token lifetime, defaults to 30 minutes
 * @param issuer   optional {@code iss} claim to set and enforce
 */
@ConfigurationProperties(prefix = "bastion.token")
@Validated
public record TokenProperties(@NotBlank String secret, Duration validity, String issuer) {

    public TokenProperties {
        if (validity == null || validity.isZero() || validity.isNegative()) {
            validity = Duration.ofMinutes(30);
        }
    }
}
