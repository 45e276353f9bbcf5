package com.shelfwise.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the inventory database.
 *
 * <p>Spring Boot binds this record from {@code application.yml}; Bean Validation ({@code
 * @Validated}) rejects missing connection settings at startup rather than at migration time.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * shelfwise:
 *   flyway:
 *     url: jdbc:postgresql://localhost:5432/store_inventory
 *     username: postgres
 *     password: postgres
 *     locations: classpath:db/migration/inventory
 *     enabled: true
 * }</pre>
 *
 * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/store_inventory})
 * @param username Database username
 * @param password Database password
 * @param locations Flyway SQL migration locations; defaults to {@link #DEFAULT_LOCATIONS}
 * @param enabled Whether to run migrations on startup
 */
@Validated
@ConfigurationProperties(prefix = "shelfwise.flyway")
public record FlywayConfigProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        @NotBlank String locations,
        boolean enabled) {

    /** Location of the versioned SQL migrations shipped with this module. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/inventory";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
