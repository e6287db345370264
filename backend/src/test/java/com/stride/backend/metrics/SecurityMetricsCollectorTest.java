package com.stride.backend.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityMetricsCollectorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SecurityMetricsCollector collector = new SecurityMetricsCollector(registry);

    @Test
    void incrementsAreVisibleInSnapshotAndMicrometer() {
        collector.increment("login_failures");
        collector.increment("login_failures");
        collector.increment("tokens_issued");

        assertThat(collector.getMetrics()).containsEntry("login_failures", 2L).containsEntry("tokens_issued", 1L);
        assertThat(registry.get("stride.security.login_failures").counter().count()).isEqualTo(2.0);
        assertThat(collector.get("unknown")).isZero();
    }

    @Test
    void resetClearsSnapshotOnly() {
        collector.increment("requests_total");

        collector.reset();

        assertThat(collector.getMetrics()).isEmpty();
        assertThat(registry.get("stride.security.requests_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void snapshotIsACopy() {
        collector.increment("a");
        var snapshot = collector.getMetrics();

        collector.increment("a");

        assertThat(snapshot).containsEntry("a", 1L);
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 8_000; i++) {
                executor.submit(() -> collector.increment("requests_total"));
            }
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        assertThat(collector.get("requests_total")).isEqualTo(8_000);
    }

    @Test
    void blankNamesAreIgnored() {
        collector.increment(" ");
        collector.increment(null);

        assertThat(collector.getMetrics()).isEmpty();
    }
}
