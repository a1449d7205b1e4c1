package com.mylab.labservice.config;

import com.mylab.observability.MetricFactory;
import com.mylab.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metric and span helpers tagged with the service name. Tracing goes through the global
 * OpenTelemetry instance, a no-op until an agent or SDK registers one.
 */
@Configuration
public class ObservabilityConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, LabServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper(LabServiceProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.name()));
    }
}
