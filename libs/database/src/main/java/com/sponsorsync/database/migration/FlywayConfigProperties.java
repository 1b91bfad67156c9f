package com.sponsorsync.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the marketplace database.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * sponsorsync:
 *   flyway:
 *     url: jdbc:postgresql://localhost:5432/sponsorsync
 *     username: sponsorsync
 *     password: sponsorsync_dev_password
 *     locations: classpath:db/migration/sponsorsync
 *     enabled: true
 * }</pre>
 *
 * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/sponsorsync})
 * @param username Database username
 * @param password Database password
 * @param locations Flyway migration locations; defaults to {@link #DEFAULT_LOCATIONS}
 * @param enabled Whether to run migrations on startup
 */
@Validated
@ConfigurationProperties(prefix = "sponsorsync.flyway")
public record FlywayConfigProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        boolean enabled) {

    /** Classpath location of the marketplace migration scripts shipped in this module. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/sponsorsync";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
