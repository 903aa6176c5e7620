/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.mesh;

/**
 * Metric names written by {@link MeshRouterStats}.
 *
 * <p>Downstream consumers (the decision engine and the anomaly predictor's
 * feature vector) read these names verbatim; renaming one breaks them.
 */
public final class RouterMetrics {

    public static final String COMPONENT_PREFIX = "mesh_router_";

    // Counters
    public static final String CONNECTIONS_ESTABLISHED = "connections_established";
    public static final String CONNECTIONS_FAILED = "connections_failed";
    public static final String PACKETS_ROUTED = "packets_routed";
    public static final String PACKETS_DROPPED = "packets_dropped";

    // Gauges
    public static final String TOTAL_PEERS = "total_peers";
    public static final String ALIVE_PEERS = "alive_peers";
    public static final String ROUTES_CACHED = "routes_cached";

    // Series of (peer id, latency ms)
    public static final String PEER_LATENCIES = "peer_latencies";

    // Derived at read time
    public static final String SUCCESS_RATE = "success_rate";
    public static final String AVG_LATENCY = "avg_latency";
    public static final String MIN_LATENCY = "min_latency";
    public static final String MAX_LATENCY = "max_latency";

    private RouterMetrics() {
        throw new AssertionError("No instances");
    }
}
