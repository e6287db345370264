package com.stride.backend.audit;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

public enum AuditTimeframe {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    public Instant startFrom(Instant end) {
        return switch (this) {
            case HOUR -> end.minus(1, ChronoUnit.HOURS);
            case DAY -> end.minus(1, ChronoUnit.DAYS);
            case WEEK -> end.minus(7, ChronoUnit.DAYS);
            case MONTH -> end.atOffset(ZoneOffset.UTC).minusMonths(1).toInstant();
        };
    }

    public static AuditTimeframe parse(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return AuditTimeframe.valueOf(value.trim().toUpperCase());
    }
}
