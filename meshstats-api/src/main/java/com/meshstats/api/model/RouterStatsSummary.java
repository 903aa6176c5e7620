/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api.model;

import java.util.Map;
import java.util.Objects;

/**
 * Router metrics plus the ratios derived from them at read time.
 */
public record RouterStatsSummary(
        StatsSnapshot snapshot,
        double successRate,
        double avgLatency,
        double minLatency,
        double maxLatency
) {
    public RouterStatsSummary {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = snapshot.toMap();
        map.put("success_rate", successRate);
        map.put("avg_latency", avgLatency);
        map.put("min_latency", minLatency);
        map.put("max_latency", maxLatency);
        return map;
    }
}
