/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api.model;

import java.util.Map;
import java.util.Objects;

/**
 * Topology engine metrics plus the cache hit rate derived at read time.
 */
public record TopologyStatsSummary(StatsSnapshot snapshot, double cacheHitRate) {

    public TopologyStatsSummary {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = snapshot.toMap();
        map.put("cache_hit_rate", cacheHitRate);
        return map;
    }
}
