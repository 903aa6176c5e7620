/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the tracer used for report and HTTP request spans.
 *
 * <p>Settings are read by {@link #fromEnvironment()}, each with a system-property
 * fallback:
 * <pre>
 * OTEL_DISABLED=false                          no spans at all when true
 * OTEL_EXPORTER_TYPE=logging                   logging | otlp
 * OTEL_EXPORTER_OTLP_ENDPOINT=http://localhost:4317
 * SERVICE_NAME=mesh-stats
 * </pre>
 *
 * <p>The owner calls {@link #shutdown()} once to drain buffered spans.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.meshstats";
    private static final String DEFAULT_SERVICE_NAME = "mesh-stats";
    private static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider; // null for noop

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    /**
     * Tracer that records nothing.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    /**
     * Batches spans to {@code exporter}, tagged with {@code serviceName}.
     */
    public static TracingService withExporter(String serviceName, SpanExporter exporter) {
        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
        SdkTracerProvider provider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(BatchSpanProcessor.builder(exporter)
                        .setScheduleDelay(Duration.ofSeconds(5))
                        .build())
                .build();
        return new TracingService(provider.get(INSTRUMENTATION_NAME), provider);
    }

    public static TracingService fromEnvironment() {
        if (Boolean.parseBoolean(setting("OTEL_DISABLED", "false"))) {
            logger.info("Tracing disabled (OTEL_DISABLED=true)");
            return noop();
        }
        try {
            SpanExporter exporter = exporterFor(setting("OTEL_EXPORTER_TYPE", "logging"),
                    setting("OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_OTLP_ENDPOINT));
            TracingService tracing = withExporter(setting("SERVICE_NAME", DEFAULT_SERVICE_NAME), exporter);
            logger.info("Tracing initialized");
            return tracing;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Cannot initialize tracing; spans will not be recorded", e);
            return noop();
        }
    }

    static SpanExporter exporterFor(String type, String otlpEndpoint) {
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        if ("otlp".equals(normalized)) {
            logger.info("Exporting spans over OTLP to " + otlpEndpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(otlpEndpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(normalized)) {
            logger.warning("Unknown OTEL_EXPORTER_TYPE '" + type + "'; exporting spans to the log");
        }
        return LoggingSpanExporter.create();
    }

    public Tracer getTracer() {
        return tracer;
    }

    /**
     * Flushes and closes the exporter. No-op for the noop tracer.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error while draining spans", e);
        }
    }

    private static String setting(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
