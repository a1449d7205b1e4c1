package com.mylab.labservice.config;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.batch.BatchStatus;
import com.mylab.labservice.domain.handoff.Direction;
import com.mylab.labservice.domain.handoff.HandoffStatus;
import com.mylab.labservice.domain.handoff.WorkflowType;
import com.mylab.labservice.infrastructure.web.CallerContextArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, the caller context argument and wire-value enum conversion for
 * path and query parameters.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final LabServiceProperties properties;
    private final CallerContextArgumentResolver callerContextResolver;

    public WebConfig(LabServiceProperties properties, CallerContextArgumentResolver callerContextResolver) {
        this.properties = properties;
        this.callerContextResolver = callerContextResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(callerContextResolver);
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, ObjectType.class, ObjectType::fromValue);
        registry.addConverter(String.class, BatchStatus.class, BatchStatus::fromValue);
        registry.addConverter(String.class, HandoffStatus.class, HandoffStatus::fromValue);
        registry.addConverter(String.class, WorkflowType.class, WorkflowType::fromValue);
        registry.addConverter(String.class, Direction.class, Direction::fromValue);
    }
}
