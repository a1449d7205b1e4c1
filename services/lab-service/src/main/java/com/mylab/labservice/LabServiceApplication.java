package com.mylab.labservice;

import com.mylab.labservice.config.LabServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MyLab lab service: workspaces, organizations, the project/trial/sample hierarchy, derived
 * sample lineage, batch analysis authority and cross-workspace supply-chain handoffs.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation through an HTTP filter and SLF4J MDC
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Flyway migrations of the lab schema at startup
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(LabServiceProperties.class)
public class LabServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(LabServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LabServiceApplication.class, args);
        log.info("MyLab lab service started successfully");
    }
}
