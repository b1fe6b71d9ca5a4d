package com.tokencatalog.importer.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Import spans go to a no-op {@link OpenTelemetry} unless the deployment registers an SDK instance.
 */
@Configuration
public class TracingConfig {

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    @Bean
    public Tracer importTracer(OpenTelemetry openTelemetry,
                               @Value("${spring.application.name:token-catalog-importer}") String instrumentationName) {
        return openTelemetry.getTracer(instrumentationName);
    }
}
