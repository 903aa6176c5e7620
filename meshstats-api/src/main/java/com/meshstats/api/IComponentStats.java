/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api;

import com.meshstats.api.model.MetricValue;
import com.meshstats.api.model.Sample;
import com.meshstats.api.model.StatsSnapshot;

import java.util.List;
import java.util.Set;

/**
 * Contract for the per-component metrics collector.
 *
 * <p>A component (router, topology engine, ...) owns exactly one instance and is
 * its only writer. Reporting threads read snapshots from it concurrently.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IComponentStats stats = new MetricsRegistry("mesh_router_node-A");
 *
 * stats.incrementCounter("packets_routed");
 * stats.setGauge("alive_peers", 4);
 * stats.addToSet("known_peers", "peer-7");
 * stats.addRecent("peer_latencies", MetricValue.of("peer-7", 12.5));
 *
 * StatsSnapshot snapshot = stats.getStatsSnapshot();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. Synchronization is per metric name:
 * operations on two different names never block each other, while operations on
 * the same name are serialized. A metric is created lazily on its first write,
 * and creation itself must be atomic so that racing first writers share one
 * metric and lose no updates.
 */
public interface IComponentStats {

    String getComponentName();

    /**
     * Epoch seconds of the last write or reset.
     */
    double getLastUpdate();

    // ----- counters -----

    default long incrementCounter(String name) {
        return incrementCounter(name, 1L);
    }

    /**
     * Increments the named counter, creating it on first use.
     *
     * @param name  counter name (must not be null)
     * @param delta amount to add; negative values are stored as given
     * @return the counter value after the increment
     */
    long incrementCounter(String name, long delta);

    /**
     * @return current value, or 0 if the counter was never written
     */
    long getCounter(String name);

    // ----- gauges -----

    /**
     * Sets the named gauge, creating it on first use.
     *
     * @return the stored value
     */
    double setGauge(String name, double value);

    /**
     * Atomically adds to the named gauge, creating it on first use.
     *
     * @return the gauge value after the addition
     */
    double addToGauge(String name, double delta);

    /**
     * @return current value, or 0.0 if the gauge was never written
     */
    double getGauge(String name);

    // ----- unique-item sets -----

    /**
     * @return {@code true} iff the item was not already present
     */
    boolean addToSet(String name, MetricValue item);

    default boolean addToSet(String name, String id) {
        return addToSet(name, MetricValue.of(id));
    }

    /**
     * @return {@code true} iff the item was present and has been removed
     */
    boolean removeFromSet(String name, MetricValue item);

    default boolean removeFromSet(String name, String id) {
        return removeFromSet(name, MetricValue.of(id));
    }

    int getSetSize(String name);

    /**
     * @return an unmodifiable copy of the set's current items, never the live set
     */
    Set<MetricValue> getSetItems(String name);

    // ----- recent series -----

    /**
     * Appends {@code (now, value)} to the named series, evicting the oldest
     * entry once the series is at capacity.
     */
    void addRecent(String seriesName, MetricValue value);

    default void addRecent(String seriesName, double value) {
        addRecent(seriesName, MetricValue.of(value));
    }

    /**
     * @return every retained entry, oldest first, as a copy
     */
    List<Sample> getRecent(String seriesName);

    /**
     * @param limit maximum number of most recent entries to return (0 returns none)
     * @return up to {@code limit} most recent entries, oldest first, as a copy
     * @throws IllegalArgumentException if limit is negative
     */
    List<Sample> getRecent(String seriesName, int limit);

    // ----- aggregate -----

    /**
     * Reads every metric under that metric's own synchronization.
     *
     * <p>This is not an atomic snapshot of the whole registry: with concurrent
     * writers, different names may reflect different points in time.
     */
    StatsSnapshot getStatsSnapshot();

    /**
     * Resets every counter to 0, every gauge to 0.0, and clears every set and
     * series. Metric names stay registered.
     */
    void resetAll();

    /**
     * @return sorted names of every counter, gauge, set and series known to this registry
     */
    Set<String> metricNames();
}
