/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.mesh;

/**
 * Metric names written by {@link MeshTopologyStats}.
 */
public final class TopologyMetrics {

    public static final String COMPONENT_PREFIX = "mesh_topology_";

    // Counters
    public static final String PATH_COMPUTATIONS = "path_computations";
    public static final String CACHE_HITS = "cache_hits";
    public static final String CACHE_MISSES = "cache_misses";
    public static final String FAILOVER_EVENTS = "failover_events";

    // Gauges
    public static final String TOTAL_NODES = "total_nodes";
    public static final String TOTAL_LINKS = "total_links";
    public static final String CACHE_SIZE = "cache_size";

    // Derived at read time
    public static final String CACHE_HIT_RATE = "cache_hit_rate";

    private TopologyMetrics() {
        throw new AssertionError("No instances");
    }
}
