/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.config;

import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Configuration for metrics registries, facades, the reporter and the stats
 * HTTP endpoint.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #fromEnvironment()} starts from the defaults and applies any of the
 * following, falling back to a system property of the same name:
 * <pre>
 * MESHSTATS_SERIES_CAPACITY=1000
 * MESHSTATS_LATENCY_WINDOW=100
 * MESHSTATS_REPORT_INTERVAL_SECONDS=10
 * MESHSTATS_HTTP_PORT=9464
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * StatsConfig config = StatsConfig.builder()
 *     .seriesCapacity(500)
 *     .latencyWindow(50)
 *     .build();
 *
 * MetricsRegistry registry = new MetricsRegistry("mesh_router_node-A", config, Clock.systemUTC());
 * }</pre>
 */
public final class StatsConfig {

    private static final Logger logger = Logger.getLogger(StatsConfig.class.getName());

    private static final String ENV_SERIES_CAPACITY = "MESHSTATS_SERIES_CAPACITY";
    private static final String ENV_LATENCY_WINDOW = "MESHSTATS_LATENCY_WINDOW";
    private static final String ENV_REPORT_INTERVAL_SECONDS = "MESHSTATS_REPORT_INTERVAL_SECONDS";
    private static final String ENV_HTTP_PORT = "MESHSTATS_HTTP_PORT";

    public static final int DEFAULT_SERIES_CAPACITY = 1000;
    public static final int DEFAULT_LATENCY_WINDOW = 100;
    public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofSeconds(10);
    public static final int DEFAULT_HTTP_PORT = 9464;

    private static final StatsConfig DEFAULTS = builder().build();

    private final int seriesCapacity;
    private final int latencyWindow;
    private final Duration reportInterval;
    private final int httpPort;

    private StatsConfig(Builder builder) {
        this.seriesCapacity = builder.seriesCapacity;
        this.latencyWindow = builder.latencyWindow;
        this.reportInterval = builder.reportInterval;
        this.httpPort = builder.httpPort;
    }

    public static StatsConfig defaults() {
        return DEFAULTS;
    }

    public static StatsConfig fromEnvironment() {
        return builder().applyEnvironment().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maximum number of samples each recent series retains.
     */
    public int getSeriesCapacity() {
        return seriesCapacity;
    }

    /**
     * Number of most recent latency samples used for min/avg/max.
     */
    public int getLatencyWindow() {
        return latencyWindow;
    }

    public Duration getReportInterval() {
        return reportInterval;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public Builder toBuilder() {
        return new Builder()
                .seriesCapacity(seriesCapacity)
                .latencyWindow(latencyWindow)
                .reportInterval(reportInterval)
                .httpPort(httpPort);
    }

    @Override
    public String toString() {
        return String.format("StatsConfig{seriesCapacity=%d, latencyWindow=%d, reportInterval=%s, httpPort=%d}",
                seriesCapacity, latencyWindow, reportInterval, httpPort);
    }

    public static final class Builder {
        private int seriesCapacity = DEFAULT_SERIES_CAPACITY;
        private int latencyWindow = DEFAULT_LATENCY_WINDOW;
        private Duration reportInterval = DEFAULT_REPORT_INTERVAL;
        private int httpPort = DEFAULT_HTTP_PORT;

        private Builder() {
        }

        public Builder seriesCapacity(int capacity) {
            this.seriesCapacity = capacity;
            return this;
        }

        public Builder latencyWindow(int window) {
            this.latencyWindow = window;
            return this;
        }

        public Builder reportInterval(Duration interval) {
            this.reportInterval = interval;
            return this;
        }

        public Builder httpPort(int port) {
            this.httpPort = port;
            return this;
        }

        /**
         * Overrides builder values with any {@code MESHSTATS_*} variables present.
         */
        public Builder applyEnvironment() {
            getEnvInt(ENV_SERIES_CAPACITY).ifPresent(this::seriesCapacity);
            getEnvInt(ENV_LATENCY_WINDOW).ifPresent(this::latencyWindow);
            getEnvLong(ENV_REPORT_INTERVAL_SECONDS).map(Duration::ofSeconds).ifPresent(this::reportInterval);
            getEnvInt(ENV_HTTP_PORT).ifPresent(this::httpPort);
            return this;
        }

        public StatsConfig build() {
            if (seriesCapacity <= 0) {
                throw new IllegalArgumentException("seriesCapacity must be positive: " + seriesCapacity);
            }
            if (latencyWindow <= 0) {
                throw new IllegalArgumentException("latencyWindow must be positive: " + latencyWindow);
            }
            if (reportInterval == null || reportInterval.isZero() || reportInterval.isNegative()) {
                throw new IllegalArgumentException("reportInterval must be positive: " + reportInterval);
            }
            if (httpPort < 0 || httpPort > 65535) {
                throw new IllegalArgumentException("httpPort out of range: " + httpPort);
            }
            return new StatsConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded setting: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
