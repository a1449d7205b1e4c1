package com.mylab.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Flyway settings bound from {@code mylab.flyway.*}.
 *
 * <pre>{@code
 * mylab:
 *   flyway:
 *     lab:
 *       locations: classpath:db/migration/lab
 *       enabled: true
 *       baseline-on-migrate: true
 * }</pre>
 *
 * @param lab settings for the lab database
 */
@Validated
@ConfigurationProperties(prefix = "mylab.flyway")
public record FlywayConfigProperties(@NotNull @Valid DatabaseConfig lab) {

    /**
     * Settings for one database's Flyway instance. Migrations run against the application
     * {@link javax.sql.DataSource}.
     *
     * @param locations         migration locations (e.g., {@code classpath:db/migration/lab})
     * @param enabled           whether migrations run on startup
     * @param baselineOnMigrate whether to baseline a non-empty schema without history
     */
    public record DatabaseConfig(
            @NotBlank String locations,
            boolean enabled,
            boolean baselineOnMigrate) {}
}
