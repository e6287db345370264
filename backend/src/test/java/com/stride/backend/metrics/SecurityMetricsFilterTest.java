package com.stride.backend.metrics;

import com.stride.backend.audit.SecurityAuditor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SecurityMetricsFilterTest {

    private final SecurityMetricsCollector metrics = new SecurityMetricsCollector(new SimpleMeterRegistry());
    private final SecurityAuditor securityAuditor = mock(SecurityAuditor.class);
    private final SecurityMetricsFilter filter = new SecurityMetricsFilter(metrics, securityAuditor);

    @Test
    void countsRequestAndStatusClass() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/verify");
        request.addHeader("User-Agent", "Mozilla/5.0 (X11; Linux x86_64)");
        MockHttpServletResponse response = new MockHttpServletResponse();
        response.setStatus(401);

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(metrics.get("requests_total")).isEqualTo(1);
        assertThat(metrics.get("requests_get")).isEqualTo(1);
        assertThat(metrics.get("response_4xx")).isEqualTo(1);
        assertThat(metrics.get("client_errors")).isEqualTo(1);
        assertThat(metrics.get("auth_failures")).isEqualTo(1);
        verify(securityAuditor, never()).suspiciousActivity(any(), any(), anyMap());
    }

    @Test
    void missingUserAgentIsFlagged() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(metrics.get("suspicious_user_agent")).isEqualTo(1);
        assertThat(metrics.get("response_2xx")).isEqualTo(1);
        verify(securityAuditor).suspiciousActivity(eq(request), eq("unusual_user_agent"), anyMap());
    }

    @Test
    void serverErrorsAreCounted() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/x");
        request.addHeader("User-Agent", "curl/8.4.0-test");
        MockHttpServletResponse response = new MockHttpServletResponse();
        response.setStatus(503);

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(metrics.get("server_errors")).isEqualTo(1);
        assertThat(metrics.get("response_5xx")).isEqualTo(1);
    }
}
