/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.metrics;

import com.meshstats.api.model.MetricValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Named set of unique items. Membership checks and mutations are serialized on
 * this set only.
 */
final class UniqueSet {

    private final String name;
    private final Set<MetricValue> items = new HashSet<>();

    UniqueSet(String name) {
        this.name = name;
    }

    synchronized boolean add(MetricValue item) {
        return items.add(item);
    }

    synchronized boolean remove(MetricValue item) {
        return items.remove(item);
    }

    synchronized int size() {
        return items.size();
    }

    synchronized Set<MetricValue> copy() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(items));
    }

    synchronized void clear() {
        items.clear();
    }

    @Override
    public synchronized String toString() {
        return String.format("UniqueSet{name='%s', size=%d}", name, items.size());
    }
}
