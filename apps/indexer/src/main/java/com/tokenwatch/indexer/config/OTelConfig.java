package com.tokenwatch.indexer.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenTelemetry configuration.
 * Initializes OTLP exporter and provides Tracer bean when {@code indexer.tracing.otlp-enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "indexer.tracing.otlp-enabled", havingValue = "true")
public class OTelConfig {

    private static final Logger logger = LoggerFactory.getLogger(OTelConfig.class);

    @Value("${indexer.tracing.otlp-endpoint:http://localhost:4317}")
    private String otlpEndpoint;

    @Value("${spring.application.name:tokenwatch-indexer}")
    private String serviceName;

    /**
     * Create OpenTelemetry SDK with OTLP exporter.
     */
    @Bean(destroyMethod = "close")
    public OpenTelemetrySdk openTelemetry() {
        OtlpGrpcSpanExporter otlpExporter = OtlpGrpcSpanExporter.builder()
                .setEndpoint(otlpEndpoint)
                .setTimeout(Duration.ofSeconds(5))
                .build();

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.builder()
                        .put("service.name", serviceName)
                        .build()));

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(otlpExporter).build())
                .setResource(resource)
                .build();

        logger.info("Exporting spans to {} as service {}", otlpEndpoint, serviceName);
        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
    }

    /**
     * Provide Tracer bean for injection.
     */
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("tokenwatch-indexer", "0.1.0");
    }
}
