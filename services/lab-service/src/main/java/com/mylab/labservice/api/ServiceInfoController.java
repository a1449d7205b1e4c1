package com.mylab.labservice.api;

import com.mylab.database.migration.FlywayMigrationConfig;
import com.mylab.database.migration.MigrationService;
import com.mylab.labservice.config.LabServiceProperties;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated service info, including the applied schema version.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final LabServiceProperties properties;
    private final ObjectProvider<MigrationService> migrations;

    public ServiceInfoController(LabServiceProperties properties, ObjectProvider<MigrationService> migrations) {
        this.properties = properties;
        this.migrations = migrations;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("status", "running");
        MigrationService migrationService = migrations.getIfAvailable();
        if (migrationService != null) {
            migrationService.getStatus(FlywayMigrationConfig.LAB_DATABASE)
                    .ifPresent(status -> info.put("schemaVersion", status.currentVersion()));
        }
        info.put("timestamp", Instant.now().toString());
        return info;
    }
}
