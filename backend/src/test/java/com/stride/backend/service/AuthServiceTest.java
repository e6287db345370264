package com.stride.backend.service;

import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuthAuditor;
import com.stride.backend.audit.DataAuditor;
import com.stride.backend.dto.LoginRequest;
import com.stride.backend.exception.RevokedTokenException;
import com.stride.backend.exception.UnauthorizedException;
import com.stride.backend.metrics.SecurityMetricsCollector;
import com.stride.backend.security.TokenClaims;
import com.stride.backend.security.TokenService;
import com.stride.backend.security.TokenType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthServiceTest {

    private final UserService userService = mock(UserService.class);
    private final TokenService tokenService = mock(TokenService.class);
    private final AuthAuditor authAuditor = mock(AuthAuditor.class);
    private final DataAuditor dataAuditor = mock(DataAuditor.class);
    private final SecurityMetricsCollector metrics = new SecurityMetricsCollector(new SimpleMeterRegistry());
    private final AuthService authService = new AuthService(userService, tokenService, authAuditor, dataAuditor, metrics);

    @Test
    void failedLoginIsCountedAndAudited() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        when(userService.authenticate("ann@example.com", "nope")).thenThrow(new UnauthorizedException("Invalid credentials"));

        assertThatThrownBy(() -> authService.login(new LoginRequest("ann@example.com", "nope"), request))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(metrics.get("login_failures")).isEqualTo(1);
        verify(authAuditor).login(eq(request), isNull(), eq(AuditOutcome.FAILURE),
                eq(Map.of("reason", "invalid_credentials")));
        verify(tokenService, never()).issue(any(), any());
    }

    @Test
    void refreshForDeletedAccountRevokesToken() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        TokenClaims claims = new TokenClaims("gone", "gone@example.com", "jti-9", TokenType.REFRESH,
                now, now.plusSeconds(3600));
        when(tokenService.validate("refresh-token", TokenType.REFRESH)).thenReturn(claims);
        when(userService.findById("gone")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.refresh("refresh-token", request))
                .isInstanceOf(RevokedTokenException.class);

        verify(tokenService).revoke("jti-9", claims.expiresAt());
        verify(tokenService, never()).refresh(any());
        verify(authAuditor).refresh(request, "gone", AuditOutcome.FAILURE);
    }

    @Test
    void logoutWithoutBearerHeaderIsUnauthorized() {
        when(tokenService.extractBearerToken(null)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.logout(null, null, new MockHttpServletRequest()))
                .isInstanceOf(UnauthorizedException.class);
    }
}
