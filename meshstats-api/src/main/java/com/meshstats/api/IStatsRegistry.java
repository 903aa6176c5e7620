/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api;

import com.meshstats.api.model.StatsSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide directory of component metrics.
 *
 * <p>One instance is constructed at startup and handed to every component that
 * publishes metrics. Registration is rare (component startup); lookups and
 * snapshot sweeps are frequent. Entries are never removed.
 */
public interface IStatsRegistry {

    /**
     * Registers a component's metrics. A later registration under the same id
     * replaces the earlier one.
     */
    void register(String componentId, IComponentStats stats);

    /**
     * @return the registered metrics, or empty if the id is unknown
     */
    Optional<IComponentStats> get(String componentId);

    /**
     * Snapshots every registered component.
     *
     * <p>The directory lock is held only while copying the entries; snapshots
     * are taken afterwards, so components may be captured at visibly different
     * instants.
     *
     * @return snapshots keyed by component id, sorted by id
     */
    Map<String, StatsSnapshot> getAllStats();

    Set<String> componentIds();

    int size();
}
