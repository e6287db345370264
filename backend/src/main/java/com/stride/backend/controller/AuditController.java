package com.stride.backend.controller;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuditQuery;
import com.stride.backend.audit.AuditService;
import com.stride.backend.audit.AuditStatistics;
import com.stride.backend.audit.AuditTimeframe;
import com.stride.backend.audit.RiskLevel;
import com.stride.backend.dto.AuditEventResponse;
import com.stride.backend.exception.ValidationException;
import com.stride.backend.model.AuditEvent;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Read access to the audit log. Admin only.
 */
@Tag(name = "audit")
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping("/events")
    public ResponseEntity<List<AuditEventResponse>> events(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String resource,
            @RequestParam(required = false) String outcome,
            @RequestParam(required = false) String riskLevel,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        AuditQuery query = AuditQuery.builder()
                .userId(userId)
                .action(action == null ? null : AuditAction.fromCode(action)
                        .orElseThrow(() -> new ValidationException("Unknown audit action: " + action)))
                .resource(resource)
                .outcome(parseEnum(AuditOutcome.class, "outcome", outcome))
                .riskLevel(parseEnum(RiskLevel.class, "riskLevel", riskLevel))
                .startDate(startDate)
                .endDate(endDate)
                .limit(limit)
                .offset(offset)
                .build();
        List<AuditEventResponse> events = auditService.queryEvents(query).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/statistics")
    public ResponseEntity<AuditStatistics> statistics(@RequestParam(required = false) String timeframe) {
        AuditTimeframe window;
        try {
            window = AuditTimeframe.parse(timeframe);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("timeframe must be one of hour, day, week, month");
        }
        return ResponseEntity.ok(auditService.getStatistics(window));
    }

    private AuditEventResponse toResponse(AuditEvent event) {
        return AuditEventResponse.builder()
                .id(event.getId())
                .timestamp(event.getTimestamp())
                .userId(event.getUserId())
                .action(event.getAction())
                .resource(event.getResource())
                .resourceId(event.getResourceId())
                .outcome(event.getOutcome())
                .riskLevel(event.getRiskLevel())
                .details(auditService.readDetails(event))
                .ipAddress(event.getIpAddress())
                .userAgent(event.getUserAgent())
                .sessionId(event.getSessionId())
                .correlationId(event.getCorrelationId())
                .build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + name + ": " + value);
        }
    }
}
