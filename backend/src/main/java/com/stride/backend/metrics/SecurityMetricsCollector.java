package com.stride.backend.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide security counters.
 *
 * Counts live in memory and are cleared only through {@link #reset()}; every
 * increment is also pushed to Micrometer, whose counters keep running across
 * resets.
 */
@Service
@Slf4j
public class SecurityMetricsCollector {

    static final String METER_PREFIX = "stride.security.";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Long> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> meters = new ConcurrentHashMap<>();

    public SecurityMetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void increment(String name) {
        if (name == null || name.isBlank()) {
            return;
        }
        counters.merge(name, 1L, Long::sum);
        meters.computeIfAbsent(name, key -> Counter.builder(METER_PREFIX + key).register(meterRegistry))
                .increment();
    }

    public long get(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public Map<String, Long> getMetrics() {
        return new TreeMap<>(counters);
    }

    public void reset() {
        counters.clear();
        log.info("Security metrics reset");
    }
}
