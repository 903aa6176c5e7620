/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Best-effort, read-only view of one component's metrics.
 *
 * <p>Each field was read independently under the owning metric's own
 * synchronization. When writers are active, two names in the same snapshot may
 * reflect different instants; the snapshot is never a globally atomic freeze of
 * the registry.
 *
 * @param component    component name of the owning registry
 * @param lastUpdate   epoch seconds of the most recent write or reset
 * @param counters     counter values by name
 * @param gauges       gauge values by name
 * @param sets         unique-item set sizes by name
 * @param recentSeries number of retained entries per series name
 */
public record StatsSnapshot(
        String component,
        double lastUpdate,
        Map<String, Long> counters,
        Map<String, Double> gauges,
        Map<String, Integer> sets,
        Map<String, Integer> recentSeries
) {
    public StatsSnapshot {
        Objects.requireNonNull(component, "component cannot be null");
        counters = sortedCopy(counters);
        gauges = sortedCopy(gauges);
        sets = sortedCopy(sets);
        recentSeries = sortedCopy(recentSeries);
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public double gauge(String name) {
        return gauges.getOrDefault(name, 0.0);
    }

    /**
     * Renders the snapshot as the plain nested map handed to external consumers.
     *
     * <p>Keys: {@code component, last_update, counters, gauges, sets, recent_series}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("component", component);
        map.put("last_update", lastUpdate);
        map.put("counters", counters);
        map.put("gauges", gauges);
        map.put("sets", sets);
        map.put("recent_series", recentSeries);
        return map;
    }

    private static <V> Map<String, V> sortedCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
