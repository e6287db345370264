package com.stride.backend.metrics;

import com.stride.backend.audit.SecurityAuditor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Per-request security counters: volume, status classes, auth failures and
 * a couple of cheap suspicious-traffic signals.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityMetricsFilter extends OncePerRequestFilter {

    static final long SLOW_REQUEST_MS = 5_000;
    static final int MIN_USER_AGENT_LENGTH = 10;

    private final SecurityMetricsCollector securityMetrics;
    private final SecurityAuditor securityAuditor;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.currentTimeMillis();
        securityMetrics.increment("requests_total");
        securityMetrics.increment("requests_" + request.getMethod().toLowerCase(Locale.ROOT));

        String userAgent = request.getHeader("User-Agent");
        if (userAgent == null || userAgent.length() < MIN_USER_AGENT_LENGTH) {
            securityMetrics.increment("suspicious_user_agent");
            securityAuditor.suspiciousActivity(request, "unusual_user_agent",
                    Map.of("userAgent", userAgent == null ? "" : userAgent));
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            record(request, response.getStatus(), System.currentTimeMillis() - start);
        }
    }

    private void record(HttpServletRequest request, int status, long elapsedMs) {
        securityMetrics.increment("response_" + (status / 100) + "xx");
        if (status >= 400 && status < 500) {
            securityMetrics.increment("client_errors");
            if (status == HttpServletResponse.SC_UNAUTHORIZED || status == HttpServletResponse.SC_FORBIDDEN) {
                securityMetrics.increment("auth_failures");
            }
        } else if (status >= 500) {
            securityMetrics.increment("server_errors");
        }
        if (elapsedMs > SLOW_REQUEST_MS) {
            securityMetrics.increment("slow_requests");
            log.warn("Slow request {} {} took {} ms", request.getMethod(), request.getRequestURI(), elapsedMs);
            securityAuditor.suspiciousActivity(request, "slow_request",
                    Map.of("responseTimeMs", elapsedMs, "statusCode", status));
        }
    }
}
