package com.arbor.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the hierarchy database.
 *
 * <pre>{@code
 * arbor:
 *   flyway:
 *     url: jdbc:postgresql://localhost:5432/arbor
 *     username: arbor
 *     password: arbor_dev_password
 *     locations: classpath:db/migration/hierarchy
 *     enabled: true
 * }</pre>
 *
 * @param url       JDBC connection URL
 * @param username  database username
 * @param password  database password
 * @param locations Flyway migration locations, defaults to {@link #DEFAULT_LOCATIONS}
 * @param enabled   whether migrations run on startup
 */
@Validated
@ConfigurationProperties(prefix = "arbor.flyway")
public record FlywayConfigProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        boolean enabled) {

    /** Classpath location of the hierarchy migrations shipped in this module. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/hierarchy";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
