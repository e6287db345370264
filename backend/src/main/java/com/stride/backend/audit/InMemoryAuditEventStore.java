package com.stride.backend.audit;

import com.stride.backend.config.AuditProperties;
import com.stride.backend.model.AuditEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Bounded in-process store for development and tests. Once full, the oldest
 * events are dropped.
 */
@Component
@ConditionalOnProperty(prefix = "stride.audit", name = "storage", havingValue = "memory")
public class InMemoryAuditEventStore implements AuditEventStore {

    static final Comparator<AuditEvent> NEWEST_FIRST = Comparator
            .comparing(AuditEvent::getTimestamp)
            .thenComparing(AuditEvent::getId)
            .reversed();

    private final int capacity;
    private final Deque<AuditEvent> events = new ArrayDeque<>();

    @Autowired
    public InMemoryAuditEventStore(AuditProperties auditProperties) {
        this(auditProperties.getMaxMemoryEvents());
    }

    public InMemoryAuditEventStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void append(AuditEvent event) {
        events.addLast(Objects.requireNonNull(event, "event"));
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }

    @Override
    public List<AuditEvent> query(AuditQuery query, int limit, int offset) {
        return snapshot().stream()
                .filter(e -> query.userId() == null || query.userId().equals(e.getUserId()))
                .filter(e -> query.action() == null || query.action() == e.getAction())
                .filter(e -> query.resource() == null || query.resource().equals(e.getResource()))
                .filter(e -> query.outcome() == null || query.outcome() == e.getOutcome())
                .filter(e -> query.riskLevel() == null || query.riskLevel() == e.getRiskLevel())
                .filter(e -> query.startDate() == null || !e.getTimestamp().isBefore(query.startDate()))
                .filter(e -> query.endDate() == null || !e.getTimestamp().isAfter(query.endDate()))
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public long count(Instant from, Instant to) {
        return snapshot().stream().filter(e -> within(e, from, to)).count();
    }

    @Override
    public Map<String, Long> countBy(AuditDimension dimension, Instant from, Instant to) {
        Map<String, Long> counts = new TreeMap<>();
        for (AuditEvent event : snapshot()) {
            String key = dimension.keyFor(event);
            if (key != null && within(event, from, to)) {
                counts.merge(key, 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public synchronized long deleteOlderThan(Instant cutoff) {
        int before = events.size();
        events.removeIf(e -> e.getTimestamp().isBefore(cutoff));
        return before - events.size();
    }

    public synchronized int size() {
        return events.size();
    }

    private synchronized List<AuditEvent> snapshot() {
        return new ArrayList<>(events);
    }

    private static boolean within(AuditEvent event, Instant from, Instant to) {
        return !event.getTimestamp().isBefore(from) && !event.getTimestamp().isAfter(to);
    }
}
