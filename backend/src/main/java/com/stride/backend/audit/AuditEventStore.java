package com.stride.backend.audit;

import com.stride.backend.model.AuditEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only backing store for audit events.
 */
public interface AuditEventStore {

    void append(AuditEvent event);

    /**
     * Matching events, newest first (timestamp descending, id descending on ties),
     * after applying offset and limit.
     */
    List<AuditEvent> query(AuditQuery query, int limit, int offset);

    /**
     * Number of events with a timestamp in {@code [from, to]}.
     */
    long count(Instant from, Instant to);

    /**
     * Event counts in {@code [from, to]} grouped by the dimension, keyed by
     * {@link AuditDimension#keyOf(Object)}. Events without a value are skipped.
     */
    Map<String, Long> countBy(AuditDimension dimension, Instant from, Instant to);

    /**
     * Retention cleanup. Returns the number of events removed.
     */
    long deleteOlderThan(Instant cutoff);
}
