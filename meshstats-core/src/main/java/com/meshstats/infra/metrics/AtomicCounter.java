/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 64-bit counter. Every operation is a single atomic step on the value.
 */
public final class AtomicCounter {

    private final AtomicLong value = new AtomicLong(0);
    private final String name;

    public AtomicCounter(String name) {
        this.name = name;
    }

    public long increment() {
        return increment(1);
    }

    public long increment(long delta) {
        return value.addAndGet(delta);
    }

    public long get() {
        return value.get();
    }

    public void set(long newValue) {
        value.set(newValue);
    }

    /**
     * @return the value held before the reset
     */
    public long reset() {
        return value.getAndSet(0);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return String.format("AtomicCounter{name='%s', value=%d}", name, get());
    }
}
