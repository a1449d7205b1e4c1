package com.mylab.database.migration;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports migration state for the configured databases. Plain class, no Spring annotations;
 * wired in {@link FlywayMigrationConfig}.
 */
public class MigrationService {

    /**
     * One migration known to Flyway.
     *
     * @param database    logical database name
     * @param version     migration version (e.g., "2")
     * @param description migration description (e.g., "lineage and analyses")
     * @param state       Flyway state display name (e.g., "Success", "Pending")
     * @param installedOn ISO-8601 install timestamp, null when not applied
     */
    public record MigrationInfo(
            String database,
            String version,
            String description,
            String state,
            String installedOn) {}

    /**
     * Summary for one database.
     *
     * @param database          logical database name
     * @param appliedMigrations number of applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion    current schema version, null if nothing is applied
     */
    public record DatabaseStatus(
            String database,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion) {}

    private final Map<String, Flyway> flyways;

    public MigrationService(Map<String, Flyway> flyways) {
        this.flyways = new TreeMap<>(flyways);
    }

    public List<DatabaseStatus> getAllStatuses() {
        return flyways.keySet().stream()
                .map(this::status)
                .toList();
    }

    public Optional<DatabaseStatus> getStatus(String database) {
        return flyways.containsKey(database) ? Optional.of(status(database)) : Optional.empty();
    }

    public List<MigrationInfo> getMigrations(String database) {
        Flyway flyway = flyways.get(database);
        if (flyway == null) {
            return List.of();
        }
        return Arrays.stream(flyway.info().all())
                .map(info -> new MigrationInfo(
                        database,
                        info.getVersion() != null ? info.getVersion().getVersion() : null,
                        info.getDescription(),
                        info.getState().getDisplayName(),
                        info.getInstalledOn() != null ? info.getInstalledOn().toInstant().toString() : null))
                .toList();
    }

    private DatabaseStatus status(String database) {
        MigrationInfoService info = flyways.get(database).info();
        var current = info.current();
        return new DatabaseStatus(
                database,
                info.applied().length,
                info.pending().length,
                current != null && current.getVersion() != null ? current.getVersion().getVersion() : null);
    }
}
