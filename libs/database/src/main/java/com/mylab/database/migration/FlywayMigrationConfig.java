package com.mylab.database.migration;

import java.util.Map;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Flyway instance for the lab database and runs its migrations at startup.
 *
 * <p>Services importing this configuration must switch off Spring Boot's own Flyway
 * auto-configuration:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "mylab.flyway.lab", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name of the lab database Flyway instance. */
    public static final String LAB_FLYWAY_BEAN = "labFlyway";

    /** Logical name of the lab database in {@link MigrationService} reports. */
    public static final String LAB_DATABASE = "lab";

    @Bean(name = LAB_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway labFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        log.info("Configuring Flyway for database '{}' at {}", LAB_DATABASE, properties.lab().locations());
        return createFlyway(dataSource, properties.lab());
    }

    @Bean
    public MigrationService migrationService(@Qualifier(LAB_FLYWAY_BEAN) Flyway labFlyway) {
        return new MigrationService(Map.of(LAB_DATABASE, labFlyway));
    }

    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties.DatabaseConfig config) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .baselineOnMigrate(config.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
