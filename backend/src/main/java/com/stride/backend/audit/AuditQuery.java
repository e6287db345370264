package com.stride.backend.audit;

import lombok.Builder;

import java.time.Instant;

/**
 * Filter for {@link AuditService#queryEvents}. A null field matches everything.
 */
@Builder(toBuilder = true)
public record AuditQuery(
        String userId,
        AuditAction action,
        String resource,
        AuditOutcome outcome,
        RiskLevel riskLevel,
        Instant startDate,
        Instant endDate,
        Integer limit,
        Integer offset
) {

    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }

    public int limitOrDefault(int defaultLimit) {
        return limit == null ? defaultLimit : limit;
    }

    public int offsetOrZero() {
        return offset == null ? 0 : offset;
    }
}
