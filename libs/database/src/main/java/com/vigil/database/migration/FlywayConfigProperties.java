package com.vigil.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Flyway settings of the monitoring database, bound from {@code vigil.flyway}.
 *
 * <pre>{@code
 * vigil:
 *   flyway:
 *     monitoring:
 *       url: jdbc:postgresql://localhost:5432/vigil
 *       username: vigil
 *       password: ${VIGIL_DB_PASSWORD}
 *       locations: classpath:db/migration/monitoring
 *       enabled: true
 * }</pre>
 *
 * @param monitoring the history and issue database
 */
@Validated
@ConfigurationProperties(prefix = "vigil.flyway")
public record FlywayConfigProperties(@NotNull @Valid DatabaseConfig monitoring) {

    /**
     * Connection and migration settings of one database.
     *
     * @param url       JDBC URL
     * @param username  database user
     * @param password  database password, may be empty for embedded databases
     * @param locations Flyway locations, e.g. {@code classpath:db/migration/monitoring}
     * @param enabled   whether migrations run on startup
     */
    public record DatabaseConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            @NotBlank String locations,
            boolean enabled) {}
}
