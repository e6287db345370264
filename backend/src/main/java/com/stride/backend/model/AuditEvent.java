package com.stride.backend.model;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.RiskLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Append-only record of a security relevant action. There are no setters:
 * an event is never changed once built.
 */
@Entity
@Table(name = "audit_events", indexes = {
        @Index(name = "idx_audit_events_timestamp", columnList = "event_timestamp"),
        @Index(name = "idx_audit_events_user", columnList = "user_id")
})
@Getter
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AuditEvent {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 64)
    private AuditAction action;

    @Column(nullable = false, length = 128)
    private String resource;

    @Column(name = "resource_id", length = 128)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AuditOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 16)
    private RiskLevel riskLevel;

    /** JSON object, or the JSON of an encrypted field for sensitive actions. */
    @Column(length = 8192)
    private String details;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "session_id", length = 128)
    private String sessionId;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;
}
