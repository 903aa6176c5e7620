/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.registry;

import com.meshstats.api.IComponentStats;
import com.meshstats.api.IStatsRegistry;
import com.meshstats.api.model.StatsSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.StampedLock;
import java.util.logging.Logger;

/**
 * Directory of every component's metrics within the process.
 *
 * <p>Construct one instance at startup and pass it to the components that
 * publish metrics. The map is guarded by a single {@link StampedLock} that is
 * distinct from the per-metric synchronization inside each registry. Snapshots
 * are taken outside the lock.
 */
public class ComponentStatsRegistry implements IStatsRegistry {

    private static final Logger logger = Logger.getLogger(ComponentStatsRegistry.class.getName());

    private final Map<String, IComponentStats> componentStats = new HashMap<>();
    
    /**
     * Guards {@code componentStats}. Writes are rare (component startup).
     */
    private final StampedLock lock = new StampedLock();

    @Override
    public void register(String componentId, IComponentStats stats) {
        Objects.requireNonNull(componentId, "componentId cannot be null");
        Objects.requireNonNull(stats, "stats cannot be null");

        IComponentStats previous;
        long stamp = lock.writeLock();
        try {
            previous = componentStats.put(componentId, stats);
        } finally {
            lock.unlockWrite(stamp);
        }

        if (previous != null && previous != stats) {
            logger.warning(String.format("Component '%s' re-registered; previous metrics replaced", componentId));
        } else {
            logger.info(String.format("Registered metrics for component '%s'", componentId));
        }
    }

    @Override
    public Optional<IComponentStats> get(String componentId) {
        long stamp = lock.readLock();
        try {
            return Optional.ofNullable(componentStats.get(componentId));
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public Map<String, StatsSnapshot> getAllStats() {
        List<Map.Entry<String, IComponentStats>> entries;
        long stamp = lock.readLock();
        try {
            entries = new ArrayList<>(new TreeMap<>(componentStats).entrySet());
        } finally {
            lock.unlockRead(stamp);
        }

        Map<String, StatsSnapshot> snapshots = new LinkedHashMap<>();
        for (Map.Entry<String, IComponentStats> entry : entries) {
            snapshots.put(entry.getKey(), entry.getValue().getStatsSnapshot());
        }
        return Collections.unmodifiableMap(snapshots);
    }

    @Override
    public Set<String> componentIds() {
        long stamp = lock.readLock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(componentStats.keySet()));
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public int size() {
        long stamp = lock.readLock();
        try {
            return componentStats.size();
        } finally {
            lock.unlockRead(stamp);
        }
    }
}
