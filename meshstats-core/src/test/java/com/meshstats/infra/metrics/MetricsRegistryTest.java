package com.meshstats.infra.metrics;

import com.meshstats.api.model.MetricValue;
import com.meshstats.api.model.Sample;
import com.meshstats.api.model.StatsSnapshot;
import com.meshstats.infra.config.StatsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsRegistryTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test_component", StatsConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Counters are created on first increment and return the new value")
    void countersIncrement() {
        assertThat(metrics.incrementCounter("x")).isEqualTo(1L);
        assertThat(metrics.incrementCounter("x", 4)).isEqualTo(5L);
        assertThat(metrics.getCounter("x")).isEqualTo(5L);
    }

    @Test
    @DisplayName("Reading unknown names returns zero and does not register them")
    void readsDoNotCreate() {
        assertThat(metrics.getCounter("missing")).isZero();
        assertThat(metrics.getGauge("missing")).isZero();
        assertThat(metrics.getSetSize("missing")).isZero();
        assertThat(metrics.getSetItems("missing")).isEmpty();
        assertThat(metrics.getRecent("missing")).isEmpty();
        assertThat(metrics.getRecent("missing", 5)).isEmpty();

        assertThat(metrics.metricNames()).isEmpty();
        assertThat(metrics.getStatsSnapshot().counters()).isEmpty();
    }

    @Test
    @DisplayName("Repeated reads with no writes return the same value")
    void readsAreIdempotent() {
        metrics.incrementCounter("c", 3);
        metrics.setGauge("g", 1.25);

        assertThat(metrics.getCounter("c")).isEqualTo(metrics.getCounter("c"));
        assertThat(metrics.getGauge("g")).isEqualTo(metrics.getGauge("g"));
        assertThat(metrics.getStatsSnapshot()).isEqualTo(metrics.getStatsSnapshot());
    }

    @Test
    void gaugesSetAndAdd() {
        assertThat(metrics.setGauge("quality_score", 0.5)).isEqualTo(0.5);
        assertThat(metrics.addToGauge("quality_score", 0.25)).isEqualTo(0.75);
        assertThat(metrics.addToGauge("fresh", 2.0)).isEqualTo(2.0);
        assertThat(metrics.getGauge("quality_score")).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Set add/remove report whether membership changed")
    void setSemantics() {
        assertThat(metrics.addToSet("s", "a")).isTrue();
        assertThat(metrics.addToSet("s", "a")).isFalse();
        assertThat(metrics.addToSet("s", "b")).isTrue();
        assertThat(metrics.getSetSize("s")).isEqualTo(2);

        assertThat(metrics.removeFromSet("s", "a")).isTrue();
        assertThat(metrics.removeFromSet("s", "a")).isFalse();
        assertThat(metrics.getSetSize("s")).isEqualTo(1);
        assertThat(metrics.getSetItems("s")).containsExactly(MetricValue.of("b"));
    }

    @Test
    @DisplayName("Set items are a detached copy")
    void setItemsAreCopies() {
        metrics.addToSet("s", "a");

        Set<MetricValue> items = metrics.getSetItems("s");
        metrics.addToSet("s", "b");

        assertThat(items).containsExactly(MetricValue.of("a"));
        assertThatThrownBy(() -> items.add(MetricValue.of("c")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(metrics.getSetSize("s")).isEqualTo(2);
    }

    @Test
    @DisplayName("Recent series keep the last 1000 of 1500 appends, oldest first")
    void recentSeriesIsBounded() {
        for (int i = 0; i < 1500; i++) {
            metrics.addRecent("latency", i);
        }

        List<Double> values = numeric(metrics.getRecent("latency"));

        assertThat(values).hasSize(1000);
        assertThat(values.get(0)).isEqualTo(500.0);
        assertThat(values.get(999)).isEqualTo(1499.0);
    }

    @Test
    void recentSeriesHonoursLimit() {
        for (int i = 1; i <= 5; i++) {
            metrics.addRecent("s", i);
        }

        assertThat(numeric(metrics.getRecent("s", 2))).containsExactly(4.0, 5.0);
        assertThat(metrics.getRecent("s", 0)).isEmpty();
        assertThat(numeric(metrics.getRecent("s", 50))).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
        assertThatThrownBy(() -> metrics.getRecent("s", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recentSamplesAreTimestampedWithTheClock() {
        metrics.addRecent("peer_latencies", MetricValue.of("peer1", 12.0));

        Sample sample = metrics.getRecent("peer_latencies").get(0);

        assertThat(sample.timestamp()).isEqualTo(1_700_000_000.0);
        assertThat(sample.value()).isEqualTo(MetricValue.of("peer1", 12.0));
    }

    @Test
    void seriesCapacityComesFromConfig() {
        MetricsRegistry small = new MetricsRegistry("small",
                StatsConfig.builder().seriesCapacity(3).build(), Clock.systemUTC());
        for (int i = 0; i < 10; i++) {
            small.addRecent("s", i);
        }

        assertThat(numeric(small.getRecent("s"))).containsExactly(7.0, 8.0, 9.0);
    }

    @Test
    @DisplayName("Snapshot reports every metric kind for the component")
    void snapshotCollectsEverything() {
        metrics.incrementCounter("analysis_cycles", 2);
        metrics.setGauge("quality_score", 0.9);
        metrics.addToSet("quality_actions", "refactor");
        metrics.addToSet("quality_actions", "add_tests");
        metrics.addRecent("scores", 0.9);

        StatsSnapshot snapshot = metrics.getStatsSnapshot();

        assertThat(snapshot.component()).isEqualTo("test_component");
        assertThat(snapshot.lastUpdate()).isEqualTo(1_700_000_000.0);
        assertThat(snapshot.counters()).containsEntry("analysis_cycles", 2L);
        assertThat(snapshot.gauges()).containsEntry("quality_score", 0.9);
        assertThat(snapshot.sets()).containsEntry("quality_actions", 2);
        assertThat(snapshot.recentSeries()).containsEntry("scores", 1);
        assertThat(metrics.metricNames())
                .containsExactly("analysis_cycles", "quality_actions", "quality_score", "scores");
    }

    @Test
    @DisplayName("Reset zeroes all metrics but keeps names; later writes start fresh")
    void resetAll() {
        metrics.incrementCounter("c", 10);
        metrics.setGauge("g", 4.0);
        metrics.addToSet("s", "a");
        metrics.addRecent("r", 1.0);

        metrics.resetAll();

        assertThat(metrics.getCounter("c")).isZero();
        assertThat(metrics.getGauge("g")).isZero();
        assertThat(metrics.getSetSize("s")).isZero();
        assertThat(metrics.getRecent("r")).isEmpty();
        assertThat(metrics.metricNames()).containsExactly("c", "g", "r", "s");

        assertThat(metrics.incrementCounter("c")).isEqualTo(1L);
        assertThat(metrics.addToSet("s", "a")).isTrue();
    }

    @Test
    void lastUpdateFollowsWrites() {
        MutableClock clock = new MutableClock(NOW);
        MetricsRegistry registry = new MetricsRegistry("c", StatsConfig.defaults(), clock);

        clock.advanceSeconds(5);
        registry.incrementCounter("x");
        assertThat(registry.getLastUpdate()).isEqualTo(1_700_000_005.0);

        clock.advanceSeconds(5);
        registry.resetAll();
        assertThat(registry.getLastUpdate()).isEqualTo(1_700_000_010.0);
    }

    @Test
    void nullNamesFailFast() {
        assertThatThrownBy(() -> metrics.incrementCounter(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> metrics.setGauge(null, 1.0)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> metrics.addToSet("s", (MetricValue) null)).isInstanceOf(NullPointerException.class);
    }

    private static List<Double> numeric(List<Sample> samples) {
        return samples.stream()
                .map(s -> s.value().numericValue().getAsDouble())
                .collect(Collectors.toList());
    }
}
