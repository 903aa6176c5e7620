package com.meshstats.infra.metrics;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AtomicCounterTest {

    @Test
    void increment_returnsNewValue() {
        AtomicCounter counter = new AtomicCounter("packets_routed");

        assertThat(counter.increment()).isEqualTo(1L);
        assertThat(counter.increment(5)).isEqualTo(6L);
        assertThat(counter.get()).isEqualTo(6L);
        assertThat(counter.getName()).isEqualTo("packets_routed");
    }

    @Test
    void negativeDelta_isStoredAsGiven() {
        AtomicCounter counter = new AtomicCounter("c");

        counter.increment(-3);

        assertThat(counter.get()).isEqualTo(-3L);
    }

    @Test
    void reset_returnsOldValueAndZeroes() {
        AtomicCounter counter = new AtomicCounter("c");
        counter.set(42);

        assertThat(counter.reset()).isEqualTo(42L);
        assertThat(counter.get()).isZero();
    }

    @Test
    void get_isIdempotent() {
        AtomicCounter counter = new AtomicCounter("c");
        counter.increment(9);

        assertThat(counter.get()).isEqualTo(counter.get());
    }

    @Test
    void concurrentIncrements_loseNothing() throws Exception {
        AtomicCounter counter = new AtomicCounter("c");
        int threads = 8;
        int perThread = 10_000;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < perThread; i++) {
                        counter.increment();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(endLatch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(counter.get()).isEqualTo((long) threads * perThread);
    }
}
