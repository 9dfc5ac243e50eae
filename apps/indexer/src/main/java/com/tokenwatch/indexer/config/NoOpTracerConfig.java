package com.tokenwatch.indexer.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tracer used while OTLP export is off ({@code indexer.tracing.otlp-enabled=false}, the default).
 * The store, the query service and the cycle runner still open spans; they are dropped on end.
 * Mutually exclusive with {@link OTelConfig}.
 */
@Configuration
@ConditionalOnProperty(name = "indexer.tracing.otlp-enabled", havingValue = "false", matchIfMissing = true)
public class NoOpTracerConfig {

    private static final String INSTRUMENTATION_NAME = "tokenwatch-indexer";

    @Bean
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    /**
     * Same instrumentation name as the exporting setup, so span names do not depend on the profile.
     */
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
