package com.stride.backend.service;

import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuthAuditor;
import com.stride.backend.audit.DataAuditor;
import com.stride.backend.dto.AuthResponse;
import com.stride.backend.dto.LoginRequest;
import com.stride.backend.dto.RegisterRequest;
import com.stride.backend.dto.TokenVerificationResponse;
import com.stride.backend.dto.UserDto;
import com.stride.backend.exception.ConflictException;
import com.stride.backend.exception.RevokedTokenException;
import com.stride.backend.exception.TokenException;
import com.stride.backend.exception.UnauthorizedException;
import com.stride.backend.metrics.SecurityMetricsCollector;
import com.stride.backend.model.User;
import com.stride.backend.security.TokenClaims;
import com.stride.backend.security.TokenPair;
import com.stride.backend.security.TokenService;
import com.stride.backend.security.TokenType;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Account flows on top of {@link TokenService}, with audit and metrics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserService userService;
    private final TokenService tokenService;
    private final AuthAuditor authAuditor;
    private final DataAuditor dataAuditor;
    private final SecurityMetricsCollector securityMetrics;

    public AuthResponse register(RegisterRequest request, HttpServletRequest httpRequest) {
        User user;
        try {
            user = userService.register(request.getEmail(), request.getPassword());
        } catch (ConflictException e) {
            securityMetrics.increment("registration_conflicts");
            authAuditor.register(httpRequest, null, AuditOutcome.FAILURE);
            throw e;
        }
        authAuditor.register(httpRequest, user.getId(), AuditOutcome.SUCCESS);
        dataAuditor.create(httpRequest, user.getId(), "user", user.getId(), AuditOutcome.SUCCESS);
        securityMetrics.increment("registrations");
        return AuthResponse.of(tokenService.issue(user.getId(), user.getEmail()), toDto(user));
    }

    public AuthResponse login(LoginRequest request, HttpServletRequest httpRequest) {
        User user;
        try {
            user = userService.authenticate(request.getEmail(), request.getPassword());
        } catch (UnauthorizedException e) {
            securityMetrics.increment("login_failures");
            authAuditor.login(httpRequest, null, AuditOutcome.FAILURE, Map.of("reason", "invalid_credentials"));
            throw e;
        }
        securityMetrics.increment("login_success");
        authAuditor.login(httpRequest, user.getId(), AuditOutcome.SUCCESS, null);
        return AuthResponse.of(tokenService.issue(user.getId(), user.getEmail()), toDto(user));
    }

    public AuthResponse refresh(String refreshToken, HttpServletRequest httpRequest) {
        TokenClaims presented;
        try {
            presented = tokenService.validate(refreshToken, TokenType.REFRESH);
        } catch (TokenException e) {
            authAuditor.refresh(httpRequest, null, AuditOutcome.FAILURE);
            throw e;
        }
        User user = userService.findById(presented.subject()).orElse(null);
        if (user == null) {
            // account gone; the token must not outlive it
            tokenService.revoke(presented.jti(), presented.expiresAt());
            authAuditor.refresh(httpRequest, presented.subject(), AuditOutcome.FAILURE);
            throw new RevokedTokenException("Account no longer exists");
        }
        TokenPair pair;
        try {
            pair = tokenService.refresh(refreshToken);
        } catch (TokenException e) {
            authAuditor.refresh(httpRequest, user.getId(), AuditOutcome.FAILURE);
            throw e;
        }
        authAuditor.refresh(httpRequest, user.getId(), AuditOutcome.SUCCESS);
        return AuthResponse.of(pair, toDto(user));
    }

    public void logout(String authorizationHeader, String refreshToken, HttpServletRequest httpRequest) {
        String accessToken = tokenService.extractBearerToken(authorizationHeader)
                .orElseThrow(() -> new UnauthorizedException("Missing bearer token"));
        TokenClaims access = tokenService.validate(accessToken, TokenType.ACCESS);
        tokenService.logout(accessToken, refreshToken);
        authAuditor.logout(httpRequest, access.subject());
        log.info("User logged out userId={}", access.subject());
    }

    public TokenVerificationResponse verify(String authorizationHeader) {
        String accessToken = tokenService.extractBearerToken(authorizationHeader)
                .orElseThrow(() -> new UnauthorizedException("Missing bearer token"));
        TokenClaims claims = tokenService.validate(accessToken, TokenType.ACCESS);
        return TokenVerificationResponse.builder()
                .valid(true)
                .userId(claims.subject())
                .email(claims.email())
                .expiresAt(claims.expiresAt())
                .build();
    }

    private static UserDto toDto(User user) {
        return UserDto.builder()
                .id(user.getId())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
