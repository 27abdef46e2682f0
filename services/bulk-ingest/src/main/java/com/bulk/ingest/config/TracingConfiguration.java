package com.bulk.ingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import lombok.extern.slf4j.Slf4j;

/**
 * Ships spans to an OTLP collector when {@code bulk.ingest.tracing.otlp-endpoint} is set.
 *
 * <p>Tracer, propagator and span processor come from the Micrometer tracing auto-configuration;
 * this only contributes the exporter. Without an endpoint, spans are still created so trace ids
 * reach the log pattern and the Kafka headers, but nothing is exported.
 */
@Slf4j
@Configuration
@ConditionalOnExpression("!'${bulk.ingest.tracing.otlp-endpoint:}'.isBlank()")
public class TracingConfiguration {

    @Value("${spring.application.name}")
    private String serviceName;

    @Value("${bulk.ingest.tracing.otlp-endpoint}")
    private String otlpEndpoint;

    @Bean
    public OtlpGrpcSpanExporter otlpGrpcSpanExporter() {
        log.info("Exporting {} spans to {}", serviceName, otlpEndpoint);
        return OtlpGrpcSpanExporter.builder()
                .setEndpoint(otlpEndpoint)
                .build();
    }
}
