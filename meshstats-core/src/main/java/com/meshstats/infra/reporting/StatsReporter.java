/*
 * Copyright (c) 2025 Mesh Stats
 * Licensed under the Apache License, Version 2.0
 */
package com.meshstats.infra.reporting;

import com.meshstats.api.IStatsRegistry;
import com.meshstats.api.model.StatsSnapshot;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically snapshots every registered component and hands the result to a
 * consumer (dashboard feed, decision engine input, rollback monitor cache).
 *
 * <p>Runs on one daemon thread. The reporter only reads; a failing consumer is
 * logged and the next report still runs.
 */
public class StatsReporter {
    private static final Logger logger = Logger.getLogger(StatsReporter.class.getName());

    private final IStatsRegistry registry;
    private final Tracer tracer;
    private final Duration interval;
    private final Consumer<Map<String, StatsSnapshot>> sink;
    private final ScheduledExecutorService reportingExecutor;
    private final AtomicLong reportCount = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public StatsReporter(IStatsRegistry registry, Tracer tracer, Duration interval,
                         Consumer<Map<String, StatsSnapshot>> sink) {
        this(registry, tracer, interval, sink, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Stats-Reporter");
            t.setDaemon(true);
            return t;
        }));
    }

    StatsReporter(IStatsRegistry registry, Tracer tracer, Duration interval,
                  Consumer<Map<String, StatsSnapshot>> sink, ScheduledExecutorService reportingExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.reportingExecutor = Objects.requireNonNull(reportingExecutor, "reportingExecutor cannot be null");
    }

    /**
     * Schedules periodic reports. Calls after the first are ignored.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            logger.warning("Stats reporter already started; ignoring start()");
            return;
        }
        long periodMillis = interval.toMillis();
        reportingExecutor.scheduleAtFixedRate(this::reportSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        logger.info(String.format("Stats reporter started (interval=%s)", interval));
    }

    public void shutdown() {
        reportingExecutor.shutdown();
    }

    /**
     * Takes one report immediately on the calling thread.
     *
     * @return the snapshots that were handed to the consumer
     */
    public Map<String, StatsSnapshot> reportNow() {
        Span span = tracer.spanBuilder("stats-report").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            Map<String, StatsSnapshot> snapshots = registry.getAllStats();
            span.setAttribute("components", snapshots.size());

            try {
                sink.accept(snapshots);
            } catch (RuntimeException e) {
                span.recordException(e);
                logger.log(Level.WARNING, "Stats consumer failed; report dropped", e);
                return snapshots;
            }

            reportCount.incrementAndGet();
            logger.fine(String.format("Reported %d components in %.2f ms",
                    snapshots.size(), (System.nanoTime() - start) / 1_000_000.0));
            return snapshots;
        } finally {
            span.end();
        }
    }

    public long reportCount() {
        return reportCount.get();
    }

    private void reportSafely() {
        try {
            reportNow();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "An unexpected error occurred during stats reporting.", e);
        }
    }
}
