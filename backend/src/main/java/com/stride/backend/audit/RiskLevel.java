package com.stride.backend.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }
}
