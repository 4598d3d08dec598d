package com.arbor.hierarchy.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code arbor.service.*}.
 *
 * <pre>
 * arbor:
 *   service:
 *     name: hierarchy-service
 *     environment: production
 *     description: Organizational hierarchy engine
 * </pre>
 *
 * @param name        service name used for logging, metrics and tracing. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description for the info endpoint
 */
@ConfigurationProperties(prefix = "arbor.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /** Runs before Bean Validation, so defaults satisfy constraints. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
