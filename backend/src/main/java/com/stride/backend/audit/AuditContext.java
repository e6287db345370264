package com.stride.backend.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Who/where information attached to an audit event. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
public class AuditContext {

    private static final AuditContext EMPTY = AuditContext.builder().build();

    String userId;
    String resourceId;
    Map<String, Object> details;
    String ipAddress;
    String userAgent;
    String sessionId;
    String correlationId;

    public static AuditContext empty() {
        return EMPTY;
    }

    public static AuditContext forUser(String userId) {
        return AuditContext.builder().userId(userId).build();
    }

    /**
     * Pre-fills client address, user agent and session from the request.
     */
    public static AuditContextBuilder from(HttpServletRequest request) {
        AuditContextBuilder builder = AuditContext.builder();
        if (request == null) {
            return builder;
        }
        HttpSession session = request.getSession(false);
        return builder
                .ipAddress(clientIp(request))
                .userAgent(request.getHeader("User-Agent"))
                .sessionId(session == null ? null : session.getId());
    }

    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
