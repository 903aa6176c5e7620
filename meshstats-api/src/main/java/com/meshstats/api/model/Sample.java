/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.api.model;

import java.util.Objects;

/**
 * One timestamped entry of a recent series.
 *
 * @param timestamp wall-clock time of the append, in epoch seconds
 * @param value     recorded value
 */
public record Sample(double timestamp, MetricValue value) {
    public Sample {
        Objects.requireNonNull(value, "value cannot be null");
    }
}
