package com.mylab.labservice.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service settings bound from {@code mylab.service.*}:
 *
 * <pre>
 * mylab:
 *   service:
 *     name: lab-service
 *     environment: production
 *     description: Lab resource tracking
 *     cors-allowed-origins:
 *       - https://app.mylab.io
 * </pre>
 *
 * @param name service name used for logging, metrics and tracing
 * @param environment deployment environment, {@code development} when unset
 * @param description human-readable description for the info endpoint
 * @param corsAllowedOrigins origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "mylab.service")
@Validated
public record LabServiceProperties(
        @NotBlank String name, String environment, String description, List<String> corsAllowedOrigins) {

    public LabServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (corsAllowedOrigins == null || corsAllowedOrigins.isEmpty()) {
            corsAllowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
        } else {
            corsAllowedOrigins = List.copyOf(corsAllowedOrigins);
        }
    }
}
