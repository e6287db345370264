package com.stride.backend.audit;

import com.stride.backend.model.AuditEvent;

import java.util.function.Function;

/**
 * Audit event attributes that statistics are grouped by.
 */
public enum AuditDimension {
    ACTION("action", AuditEvent::getAction),
    OUTCOME("outcome", AuditEvent::getOutcome),
    RISK_LEVEL("riskLevel", AuditEvent::getRiskLevel),
    USER("userId", AuditEvent::getUserId),
    RESOURCE("resource", AuditEvent::getResource);

    private final String attribute;
    private final Function<AuditEvent, ?> accessor;

    AuditDimension(String attribute, Function<AuditEvent, ?> accessor) {
        this.attribute = attribute;
        this.accessor = accessor;
    }

    /** Entity attribute name, for criteria queries. */
    public String attribute() {
        return attribute;
    }

    /** Grouping key of the event, or null when the attribute is unset. */
    public String keyFor(AuditEvent event) {
        Object value = accessor.apply(event);
        return value == null ? null : keyOf(value);
    }

    /** Wire code for enum attributes, the plain value otherwise. */
    public String keyOf(Object value) {
        if (value instanceof AuditAction action) {
            return action.code();
        }
        if (value instanceof AuditOutcome outcome) {
            return outcome.code();
        }
        if (value instanceof RiskLevel riskLevel) {
            return riskLevel.code();
        }
        return String.valueOf(value);
    }
}
