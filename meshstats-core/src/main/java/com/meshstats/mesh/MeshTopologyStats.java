/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.mesh;

import com.meshstats.api.IComponentStats;
import com.meshstats.api.IStatsRegistry;
import com.meshstats.api.model.TopologyStatsSummary;
import com.meshstats.infra.config.StatsConfig;
import com.meshstats.infra.metrics.MetricsRegistry;

import java.time.Clock;
import java.util.Objects;

import static com.meshstats.mesh.TopologyMetrics.*;

/**
 * Telemetry for the mesh topology engine of one node.
 *
 * <p>A cache miss means a path had to be computed: {@link #recordPathComputation()}
 * always bumps {@code path_computations} and {@code cache_misses} together, and
 * there is no separate miss call. Hits are only ever recorded explicitly.
 */
public class MeshTopologyStats {

    private final String nodeId;
    private final IComponentStats metrics;

    public MeshTopologyStats(String nodeId) {
        this(nodeId, StatsConfig.defaults(), Clock.systemUTC());
    }

    public MeshTopologyStats(String nodeId, StatsConfig config, Clock clock) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId cannot be null");
        this.metrics = new MetricsRegistry(COMPONENT_PREFIX + nodeId, config, clock);
    }

    public void recordPathComputation() {
        metrics.incrementCounter(PATH_COMPUTATIONS);
        metrics.incrementCounter(CACHE_MISSES);
    }

    public void recordCacheHit() {
        metrics.incrementCounter(CACHE_HITS);
    }

    public void recordFailover() {
        metrics.incrementCounter(FAILOVER_EVENTS);
    }

    public void updateTopologyCounts(int nodes, int links) {
        metrics.setGauge(TOTAL_NODES, nodes);
        metrics.setGauge(TOTAL_LINKS, links);
    }

    public void updateCacheSize(int size) {
        metrics.setGauge(CACHE_SIZE, size);
    }

    public TopologyStatsSummary getStats() {
        long hits = metrics.getCounter(CACHE_HITS);
        long misses = metrics.getCounter(CACHE_MISSES);
        long total = hits + misses;
        double cacheHitRate = total > 0 ? (double) hits / total : 0.0;
        return new TopologyStatsSummary(metrics.getStatsSnapshot(), cacheHitRate);
    }

    public void reset() {
        metrics.resetAll();
    }

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
}
