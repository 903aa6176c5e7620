/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.metrics;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Floating-point gauge. {@link #set(double)} is last-writer-wins;
 * {@link #add(double)} is an atomic read-modify-write.
 */
public final class AtomicGauge {

    private final String name;
    private final AtomicReference<Double> value;

    public AtomicGauge(String name) {
        this.name = name;
        this.value = new AtomicReference<>(0.0);
    }

    public double set(double newValue) {
        value.set(newValue);
        return newValue;
    }

    public double add(double delta) {
        return value.accumulateAndGet(delta, Double::sum);
    }

    /**
     * Raises the gauge to {@code candidate} if it is larger; never lowers it.
     *
     * @return the gauge value after the update
     */
    public double max(double candidate) {
        return value.accumulateAndGet(candidate, Math::max);
    }

    public double get() {
        return value.get();
    }

    /**
     * @return the value held before the reset
     */
    public double reset() {
        return value.getAndSet(0.0);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return String.format("AtomicGauge{name='%s', value=%.2f}", name, get());
    }
}
