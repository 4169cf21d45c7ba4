package com.fvgscanner.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer registry for scan metrics.
 *
 * <p>Falls back to an in-memory {@link SimpleMeterRegistry} tagged with the
 * application name when no exporting registry is on the classpath. The metric
 * definitions live in {@link com.fvgscanner.observability.ScanMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "fvg-scanner");
        return registry;
    }
}
