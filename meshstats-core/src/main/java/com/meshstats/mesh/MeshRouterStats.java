/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.mesh;

import com.meshstats.api.IComponentStats;
import com.meshstats.api.IStatsRegistry;
import com.meshstats.api.model.MetricValue;
import com.meshstats.api.model.RouterStatsSummary;
import com.meshstats.api.model.Sample;
import com.meshstats.infra.config.StatsConfig;
import com.meshstats.infra.metrics.MetricsRegistry;

import java.time.Clock;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import static com.meshstats.mesh.RouterMetrics.*;

/**
 * Telemetry for one mesh router node.
 *
 * <p>Writes the fixed catalog in {@link RouterMetrics} to a single
 * {@link MetricsRegistry}. Derived values (success rate, latency min/avg/max)
 * are computed on every {@link #getStats()} call and never stored.
 *
 * <h3>Thread Safety:</h3>
 * <p>All methods may be called concurrently from router worker threads and a
 * reporting thread.
 */
public class MeshRouterStats {

    private final String nodeId;
    private final int latencyWindow;
    private final IComponentStats metrics;

    public MeshRouterStats(String nodeId) {
        this(nodeId, StatsConfig.defaults(), Clock.systemUTC());
    }

    public MeshRouterStats(String nodeId, StatsConfig config, Clock clock) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId cannot be null");
        this.latencyWindow = config.getLatencyWindow();
        this.metrics = new MetricsRegistry(COMPONENT_PREFIX + nodeId, config, clock);
    }

    public void recordConnectionEstablished() {
        metrics.incrementCounter(CONNECTIONS_ESTABLISHED);
    }

    public void recordConnectionFailed() {
        metrics.incrementCounter(CONNECTIONS_FAILED);
    }

    public void recordPacketRouted() {
        metrics.incrementCounter(PACKETS_ROUTED);
    }

    public void recordPacketDropped() {
        metrics.incrementCounter(PACKETS_DROPPED);
    }

    public void updatePeerCounts(int totalPeers, int alivePeers) {
        metrics.setGauge(TOTAL_PEERS, totalPeers);
        metrics.setGauge(ALIVE_PEERS, alivePeers);
    }

    public void updateRoutesCached(int routes) {
        metrics.setGauge(ROUTES_CACHED, routes);
    }

    public void updatePeerLatency(String peerId, double latencyMs) {
        metrics.addRecent(PEER_LATENCIES, MetricValue.of(peerId, latencyMs));
    }

    /**
     * Snapshot of the router's metrics with derived ratios.
     *
     * <p>Latency figures cover the last {@code latencyWindow} samples of
     * {@code peer_latencies}; all three are 0.0 when no sample exists.
     */
    public RouterStatsSummary getStats() {
        long established = metrics.getCounter(CONNECTIONS_ESTABLISHED);
        long failed = metrics.getCounter(CONNECTIONS_FAILED);
        long attempts = established + failed;
        double successRate = attempts > 0 ? (double) established / attempts : 0.0;

        DoubleSummaryStatistics latency = recentLatencies(metrics.getRecent(PEER_LATENCIES, latencyWindow));
        boolean hasLatency = latency.getCount() > 0;

        return new RouterStatsSummary(
                metrics.getStatsSnapshot(),
                successRate,
                hasLatency ? latency.getAverage() : 0.0,
                hasLatency ? latency.getMin() : 0.0,
                hasLatency ? latency.getMax() : 0.0
        );
    }

    public void reset() {
        metrics.resetAll();
    }

    /**
     * Publishes this router's registry under {@link #getComponentId()}.
     */
    public void registerWith(IStatsRegistry registry) {
        registry.register(getComponentId(), metrics);
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getComponentId() {
        return metrics.getComponentName();
    }

    public IComponentStats getMetrics() {
        return metrics;
    }

    private static DoubleSummaryStatistics recentLatencies(List<Sample> samples) {
        DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
        for (Sample sample : samples) {
            OptionalDouble latency = sample.value().numericValue();
            latency.ifPresent(stats::accept);
        }
        return stats;
    }
}
