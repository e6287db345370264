package com.stride.backend.dto;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEventResponse {
    private String id;
    private Instant timestamp;
    private String userId;
    private AuditAction action;
    private String resource;
    private String resourceId;
    private AuditOutcome outcome;
    private RiskLevel riskLevel;
    private Map<String, Object> details;
    private String ipAddress;
    private String userAgent;
    private String sessionId;
    private String correlationId;
}
