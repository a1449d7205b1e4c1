package com.mylab.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Configuration;

/**
 * Applies the real lab migrations to an in-memory H2 database in PostgreSQL mode.
 */
@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    private JdbcDataSource dataSource;
    private Flyway flyway;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:migration-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        flyway = FlywayMigrationConfig.createFlyway(dataSource,
                new FlywayConfigProperties.DatabaseConfig("classpath:db/migration/lab", true, true));
    }

    @Test
    @DisplayName("is a Spring configuration class")
    void isConfiguration() {
        assertThat(FlywayMigrationConfig.class.isAnnotationPresent(Configuration.class)).isTrue();
        assertThat(FlywayMigrationConfig.LAB_FLYWAY_BEAN).isEqualTo("labFlyway");
    }

    @Nested
    @DisplayName("migrate")
    class Migrate {

        @Test
        @DisplayName("creates every lab table")
        void createsTables() throws SQLException {
            flyway.migrate();

            for (String table : List.of(
                    "workspaces", "organizations", "projects", "trial_parameter_templates", "trials",
                    "samples", "derived_samples", "batches", "batch_items", "analyses",
                    "access_grants", "supply_chain_requests")) {
                assertThat(rowCount(table)).as(table).isZero();
            }
        }

        @Test
        @DisplayName("reports applied migrations through MigrationService")
        void reportsStatus() {
            var service = new MigrationService(Map.of("lab", flyway));
            assertThat(service.getStatus("lab")).get()
                    .extracting(MigrationService.DatabaseStatus::pendingMigrations)
                    .isEqualTo(3);

            flyway.migrate();

            var status = service.getStatus("lab").orElseThrow();
            assertThat(status.appliedMigrations()).isEqualTo(3);
            assertThat(status.pendingMigrations()).isZero();
            assertThat(status.currentVersion()).isEqualTo("3");
            assertThat(service.getMigrations("lab"))
                    .extracting(MigrationService.MigrationInfo::state)
                    .containsOnly("Success");
        }

        @Test
        @DisplayName("unknown databases have no status")
        void unknownDatabase() {
            var service = new MigrationService(Map.of("lab", flyway));

            assertThat(service.getStatus("billing")).isEmpty();
            assertThat(service.getMigrations("billing")).isEmpty();
            assertThat(service.getAllStatuses()).hasSize(1);
        }
    }

    private int rowCount(String table) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
