package com.stride.backend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stride.backend.audit.SecurityAuditor;
import com.stride.backend.dto.ApiError;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;
    private final SecurityAuditor securityAuditor;

    public RestAccessDeniedHandler(ObjectMapper objectMapper, SecurityAuditor securityAuditor) {
        this.objectMapper = objectMapper;
        this.securityAuditor = securityAuditor;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException, ServletException {
        securityAuditor.accessDenied(request, currentUserId(), request.getRequestURI());

        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(HttpServletResponse.SC_FORBIDDEN)
                .error("FORBIDDEN")
                .errorCode("FORBIDDEN")
                .message("Access denied")
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .build();
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType("application/json");
        objectMapper.writeValue(response.getOutputStream(), error);
    }

    private String currentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof UserPrincipal principal) {
            return principal.getUserId();
        }
        return null;
    }
}
