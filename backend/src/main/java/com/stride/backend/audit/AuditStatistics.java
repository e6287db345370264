package com.stride.backend.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AuditStatistics(
        AuditTimeframe timeframe,
        Instant from,
        Instant to,
        long totalEvents,
        Map<String, Long> byAction,
        Map<String, Long> byOutcome,
        Map<String, Long> byRiskLevel,
        List<Count> topUsers,
        List<Count> topResources
) {

    public record Count(String key, long count) {
    }
}
