package com.meshstats.mesh;

import com.meshstats.api.model.RouterStatsSummary;
import com.meshstats.api.model.Sample;
import com.meshstats.infra.config.StatsConfig;
import com.meshstats.infra.registry.ComponentStatsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.meshstats.mesh.RouterMetrics.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MeshRouterStatsTest {

    private MeshRouterStats router;

    @BeforeEach
    void setUp() {
        router = new MeshRouterStats("node-A", StatsConfig.defaults(),
                Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    }

    @Test
    void componentIdIsPrefixedNodeId() {
        assertThat(router.getNodeId()).isEqualTo("node-A");
        assertThat(router.getComponentId()).isEqualTo("mesh_router_node-A");
        assertThat(router.getStats().snapshot().component()).isEqualTo("mesh_router_node-A");
    }

    @Test
    @DisplayName("Three established and one failed connection give a 0.75 success rate")
    void successRate() {
        router.recordConnectionEstablished();
        router.recordConnectionEstablished();
        router.recordConnectionEstablished();
        router.recordConnectionFailed();

        RouterStatsSummary stats = router.getStats();

        assertThat(stats.successRate()).isEqualTo(0.75);
        assertThat(stats.snapshot().counter(CONNECTIONS_ESTABLISHED)).isEqualTo(3L);
        assertThat(stats.snapshot().counter(CONNECTIONS_FAILED)).isEqualTo(1L);
    }

    @Test
    @DisplayName("Derived values are 0.0 before any connection or latency sample")
    void emptyRouterDerivesZeros() {
        RouterStatsSummary stats = router.getStats();

        assertThat(stats.successRate()).isZero();
        assertThat(stats.avgLatency()).isZero();
        assertThat(stats.minLatency()).isZero();
        assertThat(stats.maxLatency()).isZero();
    }

    @Test
    void latencyMinAvgMax() {
        router.updatePeerLatency("peer1", 120);
        router.updatePeerLatency("peer2", 80);

        RouterStatsSummary stats = router.getStats();

        assertThat(stats.avgLatency()).isEqualTo(100.0);
        assertThat(stats.minLatency()).isEqualTo(80.0);
        assertThat(stats.maxLatency()).isEqualTo(120.0);
        assertThat(stats.snapshot().recentSeries()).containsEntry(PEER_LATENCIES, 2);
    }

    @Test
    @DisplayName("Latency figures only cover the configured window of most recent samples")
    void latencyWindow() {
        MeshRouterStats windowed = new MeshRouterStats("node-B",
                StatsConfig.builder().latencyWindow(2).build(), Clock.systemUTC());
        windowed.updatePeerLatency("peer1", 1000);
        windowed.updatePeerLatency("peer1", 10);
        windowed.updatePeerLatency("peer2", 30);

        RouterStatsSummary stats = windowed.getStats();

        assertThat(stats.avgLatency()).isCloseTo(20.0, within(1e-9));
        assertThat(stats.maxLatency()).isEqualTo(30.0);
    }

    @Test
    void latencySamplesKeepPeerIdentity() {
        router.updatePeerLatency("peer1", 42.5);

        List<Sample> samples = router.getMetrics().getRecent(PEER_LATENCIES);

        assertThat(samples).hasSize(1);
        assertThat(samples.get(0).value()).isEqualTo(com.meshstats.api.model.MetricValue.of("peer1", 42.5));
    }

    @Test
    void gaugesAndPacketCounters() {
        router.updatePeerCounts(5, 3);
        router.updateRoutesCached(12);
        router.recordPacketRouted();
        router.recordPacketRouted();
        router.recordPacketDropped();

        RouterStatsSummary stats = router.getStats();

        assertThat(stats.snapshot().gauge(TOTAL_PEERS)).isEqualTo(5.0);
        assertThat(stats.snapshot().gauge(ALIVE_PEERS)).isEqualTo(3.0);
        assertThat(stats.snapshot().gauge(ROUTES_CACHED)).isEqualTo(12.0);
        assertThat(stats.snapshot().counter(PACKETS_ROUTED)).isEqualTo(2L);
        assertThat(stats.snapshot().counter(PACKETS_DROPPED)).isEqualTo(1L);
    }

    @Test
    void summaryMapCarriesDerivedKeys() {
        router.recordConnectionEstablished();
        router.updatePeerLatency("peer1", 50);

        Map<String, Object> map = router.getStats().toMap();

        assertThat(map).containsKeys("component", "last_update", "counters", "gauges", "sets", "recent_series");
        assertThat(map).containsEntry(SUCCESS_RATE, 1.0)
                .containsEntry(AVG_LATENCY, 50.0)
                .containsEntry(MIN_LATENCY, 50.0)
                .containsEntry(MAX_LATENCY, 50.0);
    }

    @Test
    void resetClearsEverything() {
        router.recordConnectionEstablished();
        router.updatePeerLatency("peer1", 50);

        router.reset();

        RouterStatsSummary stats = router.getStats();
        assertThat(stats.successRate()).isZero();
        assertThat(stats.avgLatency()).isZero();
        assertThat(stats.snapshot().counter(CONNECTIONS_ESTABLISHED)).isZero();
    }

    @Test
    void registersUnderComponentId() {
        ComponentStatsRegistry registry = new ComponentStatsRegistry();

        router.registerWith(registry);
        router.recordPacketRouted();

        assertThat(registry.get("mesh_router_node-A")).containsSame(router.getMetrics());
        assertThat(registry.getAllStats().get("mesh_router_node-A").counter(PACKETS_ROUTED)).isEqualTo(1L);
    }
}
