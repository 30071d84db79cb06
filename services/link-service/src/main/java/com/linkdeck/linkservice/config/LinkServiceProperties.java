package com.linkdeck.linkservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code linkdeck.service.*}.
 *
 * <pre>
 * linkdeck:
 *   service:
 *     name: link-service
 *     environment: production
 *     description: Link management backend
 * </pre>
 *
 * @param name Service name used for logging and the {@code service} metric tag. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for /actuator/info.
 */
@ConfigurationProperties(prefix = "linkdeck.service")
@Validated
public record LinkServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public LinkServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
