package com.accesslist.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the access list registry.
 *
 * Configures:
 * - Common tags for all metrics
 * - The registry's own meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "access-list-registry");
    }

    @Bean
    public AccessListMetrics accessListMetrics() {
        return new AccessListMetrics();
    }
}
