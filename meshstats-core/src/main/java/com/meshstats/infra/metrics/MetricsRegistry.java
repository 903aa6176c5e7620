/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.metrics;

import com.meshstats.api.IComponentStats;
import com.meshstats.api.model.MetricValue;
import com.meshstats.api.model.Sample;
import com.meshstats.api.model.StatsSnapshot;
import com.meshstats.infra.config.StatsConfig;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe metrics collector owned by a single component.
 *
 * <p>Holds four independent collections keyed by metric name: counters, gauges,
 * unique-item sets and bounded recent series. Each collection is a
 * {@link ConcurrentHashMap}; a metric is created on its first write through
 * {@code computeIfAbsent}, so threads racing on a brand-new name always end up
 * sharing one instance. Each metric then synchronizes on its own state only, so
 * writes to different names never contend.
 *
 * <p>Reads of unknown names return zero or empty and do not create the metric.
 *
 * <pre>{@code
 * MetricsRegistry metrics = new MetricsRegistry("mapek_quality");
 * metrics.setGauge("quality_score", 0.92);
 * metrics.incrementCounter("analysis_cycles");
 *
 * assertThat(metrics.getCounter("analysis_cycles")).isEqualTo(1L);
 * }</pre>
 */
public final class MetricsRegistry implements IComponentStats {

    private static final Logger logger = Logger.getLogger(MetricsRegistry.class.getName());

    private final String componentName;
    private final int seriesCapacity;
    private final Clock clock;

    private final Map<String, AtomicCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, UniqueSet> sets = new ConcurrentHashMap<>();
    private final Map<String, RecentSeries> series = new ConcurrentHashMap<>();

    private final AtomicGauge lastUpdate = new AtomicGauge("last_update");

    public MetricsRegistry(String componentName) {
        this(componentName, StatsConfig.defaults(), Clock.systemUTC());
    }

    public MetricsRegistry(String componentName, StatsConfig config, Clock clock) {
        this.componentName = Objects.requireNonNull(componentName, "componentName cannot be null");
        this.seriesCapacity = Objects.requireNonNull(config, "config cannot be null").getSeriesCapacity();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        touch();
    }

    @Override
    public String getComponentName() {
        return componentName;
    }

    @Override
    public double getLastUpdate() {
        return lastUpdate.get();
    }

    // ========================================================================
    // COUNTERS
    // ========================================================================

    @Override
    public long incrementCounter(String name, long delta) {
        long newValue = counter(name).increment(delta);
        touch();
        return newValue;
    }

    @Override
    public long getCounter(String name) {
        AtomicCounter counter = counters.get(name);
        return counter != null ? counter.get() : 0L;
    }

    // ========================================================================
    // GAUGES
    // ========================================================================

    @Override
    public double setGauge(String name, double value) {
        double stored = gauge(name).set(value);
        touch();
        return stored;
    }

    @Override
    public double addToGauge(String name, double delta) {
        double newValue = gauge(name).add(delta);
        touch();
        return newValue;
    }

    @Override
    public double getGauge(String name) {
        AtomicGauge gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0.0;
    }

    // ========================================================================
    // UNIQUE-ITEM SETS
    // ========================================================================

    @Override
    public boolean addToSet(String name, MetricValue item) {
        Objects.requireNonNull(item, "item cannot be null");
        boolean added = set(name).add(item);
        touch();
        return added;
    }

    @Override
    public boolean removeFromSet(String name, MetricValue item) {
        Objects.requireNonNull(item, "item cannot be null");
        boolean removed = set(name).remove(item);
        touch();
        return removed;
    }

    @Override
    public int getSetSize(String name) {
        UniqueSet set = sets.get(name);
        return set != null ? set.size() : 0;
    }

    @Override
    public Set<MetricValue> getSetItems(String name) {
        UniqueSet set = sets.get(name);
        return set != null ? set.copy() : Collections.emptySet();
    }

    // ========================================================================
    // RECENT SERIES
    // ========================================================================

    @Override
    public void addRecent(String seriesName, MetricValue value) {
        Objects.requireNonNull(value, "value cannot be null");
        series(seriesName).add(new Sample(now(), value));
        touch();
    }

    @Override
    public List<Sample> getRecent(String seriesName) {
        RecentSeries recent = series.get(seriesName);
        return recent != null ? recent.getAll() : Collections.emptyList();
    }

    @Override
    public List<Sample> getRecent(String seriesName, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }
        RecentSeries recent = series.get(seriesName);
        return recent != null ? recent.latest(limit) : Collections.emptyList();
    }

    // ========================================================================
    // AGGREGATE
    // ========================================================================

    /**
     * {@inheritDoc}
     *
     * <p>Map iteration is weakly consistent and every value is read on its own,
     * so a name created or written during the sweep may or may not appear, and
     * two names may be captured at different instants.
     */
    @Override
    public StatsSnapshot getStatsSnapshot() {
        Map<String, Long> counterValues = new HashMap<>();
        counters.forEach((name, counter) -> counterValues.put(name, counter.get()));

        Map<String, Double> gaugeValues = new HashMap<>();
        gauges.forEach((name, gauge) -> gaugeValues.put(name, gauge.get()));

        Map<String, Integer> setSizes = new HashMap<>();
        sets.forEach((name, set) -> setSizes.put(name, set.size()));

        Map<String, Integer> seriesCounts = new HashMap<>();
        series.forEach((name, recent) -> seriesCounts.put(name, recent.size()));

        return new StatsSnapshot(componentName, lastUpdate.get(),
                counterValues, gaugeValues, setSizes, seriesCounts);
    }

    @Override
    public void resetAll() {
        counters.values().forEach(AtomicCounter::reset);
        gauges.values().forEach(AtomicGauge::reset);
        sets.values().forEach(UniqueSet::clear);
        series.values().forEach(RecentSeries::clear);
        touch();
        logger.info(String.format("Reset all metrics for component '%s'", componentName));
    }

    @Override
    public Set<String> metricNames() {
        Set<String> names = new TreeSet<>();
        names.addAll(counters.keySet());
        names.addAll(gauges.keySet());
        names.addAll(sets.keySet());
        names.addAll(series.keySet());
        return Collections.unmodifiableSet(names);
    }

    // ========================================================================
    // LAZY CREATION
    // ========================================================================

    private AtomicCounter counter(String name) {
        return counters.computeIfAbsent(requireName(name), AtomicCounter::new);
    }

    private AtomicGauge gauge(String name) {
        return gauges.computeIfAbsent(requireName(name), AtomicGauge::new);
    }

    private UniqueSet set(String name) {
        return sets.computeIfAbsent(requireName(name), UniqueSet::new);
    }

    private RecentSeries series(String name) {
        return series.computeIfAbsent(requireName(name), n -> new RecentSeries(n, seriesCapacity));
    }

    private static String requireName(String name) {
        return Objects.requireNonNull(name, "metric name cannot be null");
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    // Never moves backwards when racing writers store out of clock order.
    private void touch() {
        lastUpdate.max(now());
    }

    @Override
    public String toString() {
        return String.format("MetricsRegistry{component='%s', counters=%d, gauges=%d, sets=%d, series=%d}",
                componentName, counters.size(), gauges.size(), sets.size(), series.size());
    }
}
