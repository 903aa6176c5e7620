package com.meshstats.benchmark;

import com.meshstats.api.model.StatsSnapshot;
import com.meshstats.infra.metrics.MetricsRegistry;
import com.meshstats.mesh.MeshRouterStats;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Write contention on a single component registry.
 * <p>
 * SCENARIOS:
 * - sharedCounter: every thread increments the same counter name
 * - distinctCounters: each thread owns its own counter name
 * - recentAppend: every thread appends to the same bounded series
 * - routerHotPath: packet routed + latency sample, the router's per-packet work
 * - snapshotUnderLoad: one snapshot per op while other threads write
 * <p>
 * USAGE:
 * mvn -pl meshstats-benchmarks -am package
 * java -cp meshstats-benchmarks/target/classes:... com.meshstats.benchmark.RegistryContentionBenchmark
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 2)
@Threads(8)
public class RegistryContentionBenchmark {

    private MetricsRegistry metrics;
    private MeshRouterStats router;

    @Setup(Level.Trial)
    public void setup() {
        metrics = new MetricsRegistry("bench");
        router = new MeshRouterStats("bench-node");
    }

    @State(Scope.Thread)
    public static class ThreadState {
        private static final AtomicInteger IDS = new AtomicInteger();

        String counterName;
        String peerId;

        @Setup(Level.Trial)
        public void setup() {
            int id = IDS.getAndIncrement();
            counterName = "counter-" + id;
            peerId = "peer-" + id;
        }
    }

    @Benchmark
    public long sharedCounter() {
        return metrics.incrementCounter("packets_routed");
    }

    @Benchmark
    public long distinctCounters(ThreadState state) {
        return metrics.incrementCounter(state.counterName);
    }

    @Benchmark
    public void recentAppend() {
        metrics.addRecent("latency", 12.5);
    }

    @Benchmark
    public void routerHotPath(ThreadState state) {
        router.recordPacketRouted();
        router.updatePeerLatency(state.peerId, 3.0);
    }

    @Benchmark
    @Group("snapshot")
    @GroupThreads(6)
    public long snapshotWriters() {
        return metrics.incrementCounter("packets_routed");
    }

    @Benchmark
    @Group("snapshot")
    @GroupThreads(2)
    public void snapshotUnderLoad(Blackhole bh) {
        StatsSnapshot snapshot = metrics.getStatsSnapshot();
        bh.consume(snapshot);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
                .include(RegistryContentionBenchmark.class.getSimpleName())
                .resultFormat(ResultFormatType.JSON)
                .result("benchmark-results-" + System.currentTimeMillis() + ".json")
                .build();

        new Runner(opt).run();
    }
}
