package com.mylab.labservice.config;

import com.mylab.database.migration.FlywayMigrationConfig;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(FlywayMigrationConfig.class)
public class PersistenceConfig {

    /** Timestamps are written in UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
