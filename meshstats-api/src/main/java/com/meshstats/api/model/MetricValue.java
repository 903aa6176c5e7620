/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Value stored in unique-item sets and recent series.
 *
 * <p>Components only ever record a handful of shapes, so the value space is
 * closed to three kinds:
 * <ul>
 *   <li>{@link Numeric} - a plain number (queue depth, throughput sample)</li>
 *   <li>{@link Id} - an identifier (peer id, decision name)</li>
 *   <li>{@link Measurement} - an identifier paired with a number (peer latency)</li>
 * </ul>
 *
 * <p>All kinds are immutable records with value equality, so set membership
 * is decided by content.
 */
public interface MetricValue {

    /**
     * Numeric part of this value.
     *
     * @return the number carried by this value, or empty for a bare identifier
     */
    OptionalDouble numericValue();

    static MetricValue of(double value) {
        return new Numeric(value);
    }

    static MetricValue of(String id) {
        return new Id(id);
    }

    static MetricValue of(String id, double value) {
        return new Measurement(id, value);
    }

    record Numeric(double value) implements MetricValue {
        @Override
        public OptionalDouble numericValue() {
            return OptionalDouble.of(value);
        }
    }

    record Id(String id) implements MetricValue {
        public Id {
            Objects.requireNonNull(id, "id cannot be null");
        }

        @Override
        public OptionalDouble numericValue() {
            return OptionalDouble.empty();
        }
    }

    record Measurement(String id, double value) implements MetricValue {
        public Measurement {
            Objects.requireNonNull(id, "id cannot be null");
        }

        @Override
        public OptionalDouble numericValue() {
            return OptionalDouble.of(value);
        }
    }
}
