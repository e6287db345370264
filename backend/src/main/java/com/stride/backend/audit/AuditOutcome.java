package com.stride.backend.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditOutcome {
    SUCCESS,
    FAILURE,
    /** Rejected by a protective control before the action ran. */
    BLOCKED;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    public boolean isNegative() {
        return this != SUCCESS;
    }
}
