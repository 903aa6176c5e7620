/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshstats.api.IComponentStats;
import com.meshstats.api.IStatsRegistry;
import com.meshstats.infra.reporting.LoggingStatsSink;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight, read-only JSON view of the component registry.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>GET /stats - snapshots of every registered component</li>
 *   <li>GET /stats/{componentId} - snapshot of one component</li>
 *   <li>GET /health - liveness and number of registered components</li>
 * </ul>
 *
 * <p>Handlers only call snapshot operations, so serving requests never blocks
 * metric writers beyond the per-name reads a snapshot performs.
 */
public class StatsHttpServer {
    private static final Logger logger = Logger.getLogger(StatsHttpServer.class.getName());

    private static final String STATS_PATH = "/stats";

    private final HttpServer server;
    private final ExecutorService executor;
    private final IStatsRegistry registry;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;

    /**
     * @param port     port to listen on; 0 binds an ephemeral port
     * @param registry component registry to serve
     * @param tracer   OpenTelemetry tracer for request spans
     * @throws IOException if the server socket cannot be bound
     */
    public StatsHttpServer(int port, IStatsRegistry registry, Tracer tracer, ObjectMapper objectMapper)
            throws IOException {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.server = HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext(STATS_PATH, new StatsHandler());
        this.server.createContext("/health", new HealthHandler());

        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "Stats-Http");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("Stats endpoint listening on port " + getPort());
    }

    public void stop(int delaySeconds) {
        server.stop(delaySeconds);
        executor.shutdown();
        logger.info("Stats endpoint stopped");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }

            Span span = tracer.spanBuilder("http-stats").startSpan();
            try (Scope scope = span.makeCurrent()) {
                String path = exchange.getRequestURI().getPath();
                if (isCollectionPath(path)) {
                    Map<String, Object> body = LoggingStatsSink.toPlainMap(registry.getAllStats());
                    sendResponse(exchange, 200, objectMapper.writeValueAsString(body));
                    return;
                }

                // The context matches by prefix, so /statsXY lands here too.
                String componentId = componentIdFrom(path);
                if (componentId == null) {
                    sendResponse(exchange, 404, "{\"error\":\"Not Found\"}");
                    return;
                }

                span.setAttribute("component", componentId);
                Optional<IComponentStats> stats = registry.get(componentId);
                if (stats.isEmpty()) {
                    sendResponse(exchange, 404, "{\"error\":\"Unknown component\"}");
                    return;
                }
                sendResponse(exchange, 200, objectMapper.writeValueAsString(stats.get().getStatsSnapshot().toMap()));
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error serving stats", e);
                sendResponse(exchange, 500, "{\"error\":\"Internal Server Error\"}");
            } finally {
                span.end();
            }
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "UP");
            body.put("components", registry.size());
            sendResponse(exchange, 200, objectMapper.writeValueAsString(body));
        }
    }

    static boolean isCollectionPath(String path) {
        return STATS_PATH.equals(path) || (STATS_PATH + "/").equals(path);
    }

    /**
     * @return the id after {@code /stats/}, or null when the path names no component
     */
    static String componentIdFrom(String path) {
        String prefix = STATS_PATH + "/";
        if (!path.startsWith(prefix) || path.length() == prefix.length()) {
            return null;
        }
        return path.substring(prefix.length());
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
