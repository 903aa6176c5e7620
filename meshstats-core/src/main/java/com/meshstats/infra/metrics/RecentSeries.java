/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.metrics;

import com.meshstats.api.model.Sample;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ring buffer for fixed-size time-series data.
 *
 * <p>Holds at most {@code capacity} samples in insertion order. Once full, each
 * append overwrites the oldest sample.
 */
final class RecentSeries {

    private final String name;
    private final Sample[] buffer;
    private int writeIndex = 0;
    private boolean wrapped = false;

    RecentSeries(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Series capacity must be positive: " + capacity);
        }
        this.name = name;
        this.buffer = new Sample[capacity];
    }

    synchronized void add(Sample sample) {
        buffer[writeIndex] = sample;
        writeIndex = (writeIndex + 1) % buffer.length;
        if (writeIndex == 0) {
            wrapped = true;
        }
    }

    synchronized int size() {
        return wrapped ? buffer.length : writeIndex;
    }

    /**
     * @return all retained samples, oldest first
     */
    synchronized List<Sample> getAll() {
        return latest(size());
    }

    /**
     * @return up to {@code limit} most recent samples, oldest first
     */
    synchronized List<Sample> latest(int limit) {
        int count = Math.min(limit, size());
        if (count == 0) {
            return Collections.emptyList();
        }
        List<Sample> result = new ArrayList<>(count);
        int start = Math.floorMod(writeIndex - count, buffer.length);
        for (int i = 0; i < count; i++) {
            result.add(buffer[(start + i) % buffer.length]);
        }
        return result;
    }

    synchronized void clear() {
        Arrays.fill(buffer, null);
        writeIndex = 0;
        wrapped = false;
    }

    int capacity() {
        return buffer.length;
    }

    @Override
    public synchronized String toString() {
        return String.format("RecentSeries{name='%s', size=%d, capacity=%d}", name, size(), buffer.length);
    }
}
