/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshstats.api.IStatsRegistry;
import com.meshstats.infra.config.StatsConfig;
import com.meshstats.infra.registry.ComponentStatsRegistry;
import com.meshstats.infra.reporting.LoggingStatsSink;
import com.meshstats.infra.reporting.StatsReporter;
import com.meshstats.infra.server.StatsHttpServer;
import com.meshstats.infra.telemetry.TracingService;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-level wiring: one component registry, its periodic reporter and the
 * stats HTTP endpoint.
 *
 * <p>Embedding services construct this once at startup and hand
 * {@link #getRegistry()} to their router and topology components.
 */
public class MeshStatsService {
    private static final Logger logger = Logger.getLogger(MeshStatsService.class.getName());

    private final StatsConfig config;
    private final TracingService tracingService;
    private final ComponentStatsRegistry registry;
    private final StatsReporter reporter;
    private final StatsHttpServer httpServer;

    public MeshStatsService(StatsConfig config, TracingService tracingService) throws IOException {
        ObjectMapper objectMapper = new ObjectMapper();
        this.config = config;
        this.tracingService = tracingService;
        this.registry = new ComponentStatsRegistry();
        this.reporter = new StatsReporter(registry, tracingService.getTracer(),
                config.getReportInterval(), new LoggingStatsSink(objectMapper));
        this.httpServer = new StatsHttpServer(config.getHttpPort(), registry,
                tracingService.getTracer(), objectMapper);
    }

    public static void main(String[] args) {
        try {
            MeshStatsService service = new MeshStatsService(StatsConfig.fromEnvironment(), TracingService.fromEnvironment());
            service.start();
            Runtime.getRuntime().addShutdownHook(new Thread(service::stop));
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Mesh stats service failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    public void start() {
        logger.info("Starting mesh stats service with " + config);
        reporter.start();
        httpServer.start();
    }

    public void stop() {
        reporter.shutdown();
        httpServer.stop(0);
        tracingService.shutdown();
        logger.info("Mesh stats service shutdown complete");
    }

    public IStatsRegistry getRegistry() {
        return registry;
    }

    public StatsReporter getReporter() {
        return reporter;
    }

    public int getHttpPort() {
        return httpServer.getPort();
    }
}
