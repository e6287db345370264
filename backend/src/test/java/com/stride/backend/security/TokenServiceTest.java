package com.stride.backend.security;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditContext;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuditService;
import com.stride.backend.config.SecurityProperties;
import com.stride.backend.exception.ExpiredTokenException;
import com.stride.backend.exception.InvalidSignatureException;
import com.stride.backend.exception.MalformedTokenException;
import com.stride.backend.exception.RevokedTokenException;
import com.stride.backend.exception.TokenException;
import com.stride.backend.exception.WrongTokenTypeException;
import com.stride.backend.metrics.SecurityMetricsCollector;
import io.jsonwebtoken.security.Keys;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenServiceTest {

    private static final String SECRET = "unit-test-secret-0123456789-abcdefghij";

    private MutableClock clock;
    private SecurityProperties properties;
    private InMemoryRevocationStore revocationStore;
    private SecurityMetricsCollector metrics;
    private AuditService auditService;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new SecurityProperties();
        revocationStore = new InMemoryRevocationStore();
        metrics = new SecurityMetricsCollector(new SimpleMeterRegistry());
        auditService = mock(AuditService.class);
        tokenService = newService(revocationStore);
    }

    private TokenService newService(RevocationStore store) {
        JwtTokenSigner signer = new JwtTokenSigner(
                Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)),
                properties.getJwt().getIssuer(), properties.getJwt().getAudience(), clock);
        return new TokenService(signer, store, properties, metrics, auditService, clock);
    }

    @Test
    void issuedAccessTokenValidates() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");

        TokenClaims claims = tokenService.validate(pair.accessToken(), TokenType.ACCESS);

        assertThat(claims.subject()).isEqualTo("u1");
        assertThat(claims.email()).isEqualTo("u1@example.com");
        assertThat(claims.type()).isEqualTo(TokenType.ACCESS);
        assertThat(claims.expiresAt()).isEqualTo(claims.issuedAt().plus(Duration.ofHours(1)));
        assertThat(pair.refreshClaims().expiresAt()).isEqualTo(pair.refreshClaims().issuedAt().plus(Duration.ofDays(7)));
        assertThat(pair.accessClaims().jti()).isNotEqualTo(pair.refreshClaims().jti());
        assertThat(metrics.get("tokens_issued")).isEqualTo(1);
    }

    @Test
    void revokedTokenIsRejected() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");
        TokenClaims claims = tokenService.validate(pair.accessToken(), TokenType.ACCESS);

        tokenService.revoke(claims.jti(), claims.expiresAt());

        assertThat(tokenService.isRevoked(claims.jti())).isTrue();
        assertThatThrownBy(() -> tokenService.validate(pair.accessToken(), TokenType.ACCESS))
                .isInstanceOf(RevokedTokenException.class);
        assertThat(metrics.get("token_rejected_revoked")).isEqualTo(1);
    }

    @Test
    void revokeIsIdempotent() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");

        tokenService.revoke(pair.accessClaims().jti(), pair.accessClaims().expiresAt());
        tokenService.revoke(pair.accessClaims().jti(), pair.accessClaims().expiresAt());

        assertThat(revocationStore.size()).isEqualTo(1);
        assertThat(metrics.get("tokens_revoked")).isEqualTo(1);
    }

    @Test
    void refreshTokenIsNotAcceptedAsAccessToken() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");

        assertThatThrownBy(() -> tokenService.validate(pair.refreshToken(), TokenType.ACCESS))
                .isInstanceOf(WrongTokenTypeException.class)
                .extracting(e -> ((TokenException) e).getReason())
                .isEqualTo(TokenException.Reason.WRONG_TYPE);
    }

    @Test
    void expiredTokenIsRejected() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThatThrownBy(() -> tokenService.validate(pair.accessToken(), TokenType.ACCESS))
                .isInstanceOf(ExpiredTokenException.class);
        assertThat(tokenService.validate(pair.refreshToken(), TokenType.REFRESH).subject()).isEqualTo("u1");
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        TokenSigner otherSigner = new JwtTokenSigner(
                Keys.hmacShaKeyFor("another-secret-0123456789-abcdefghijkl".getBytes(StandardCharsets.UTF_8)),
                properties.getJwt().getIssuer(), properties.getJwt().getAudience(), clock);
        Instant now = clock.instant();
        String forged = otherSigner.sign(new TokenClaims("u1", "u1@example.com", "jti-1", TokenType.ACCESS,
                now, now.plus(Duration.ofHours(1))));

        assertThatThrownBy(() -> tokenService.validate(forged, TokenType.ACCESS))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void tamperedPayloadIsRejected() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");
        String[] parts = pair.accessToken().split("\\.");
        TokenPair other = tokenService.issue("u2", "u2@example.com");
        String spliced = parts[0] + "." + other.accessToken().split("\\.")[1] + "." + parts[2];

        assertThatThrownBy(() -> tokenService.validate(spliced, TokenType.ACCESS))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void garbageIsMalformed() {
        assertThatThrownBy(() -> tokenService.validate("not-a-jwt", TokenType.ACCESS))
                .isInstanceOf(MalformedTokenException.class);
        assertThatThrownBy(() -> tokenService.validate("", TokenType.ACCESS))
                .isInstanceOf(MalformedTokenException.class);
        assertThat(metrics.get("token_rejected_malformed")).isEqualTo(2);
    }

    @Test
    void refreshRotatesAndRevokesPresentedToken() {
        TokenPair original = tokenService.issue("u1", "u1@example.com");
        clock.advance(Duration.ofMinutes(5));

        TokenPair rotated = tokenService.refresh(original.refreshToken());

        assertThat(rotated.refreshToken()).isNotEqualTo(original.refreshToken());
        assertThat(rotated.accessClaims().subject()).isEqualTo("u1");
        assertThat(tokenService.isRevoked(original.refreshClaims().jti())).isTrue();
        assertThat(tokenService.validate(rotated.refreshToken(), TokenType.REFRESH).subject()).isEqualTo("u1");
        assertThat(metrics.get("tokens_refreshed")).isEqualTo(1);
    }

    @Test
    void usedRefreshTokenCannotBeUsedAgain() {
        TokenPair original = tokenService.issue("u1", "u1@example.com");
        tokenService.refresh(original.refreshToken());

        assertThatThrownBy(() -> tokenService.refresh(original.refreshToken()))
                .isInstanceOf(RevokedTokenException.class);
    }

    @Test
    void concurrentReuseOfRefreshTokenIsDetected() {
        TokenPair original = tokenService.issue("u1", "u1@example.com");
        // another request revoked it between validation and rotation
        RevocationStore racing = mock(RevocationStore.class);
        when(racing.isRevoked(anyString(), any())).thenReturn(false);
        when(racing.revoke(any(), any())).thenReturn(false);
        TokenService service = newService(racing);

        assertThatThrownBy(() -> service.refresh(original.refreshToken()))
                .isInstanceOf(RevokedTokenException.class);
        verify(auditService).logEvent(eq(AuditAction.SECURITY_SUSPICIOUS_ACTIVITY), eq("token"),
                eq(AuditOutcome.BLOCKED), any(AuditContext.class));
        assertThat(metrics.get("refresh_token_reuse")).isEqualTo(1);
    }

    @Test
    void withoutRotationTheSameRefreshTokenIsReturned() {
        properties.getJwt().setRotateRefreshTokens(false);
        TokenPair original = tokenService.issue("u1", "u1@example.com");

        TokenPair first = tokenService.refresh(original.refreshToken());
        TokenPair second = tokenService.refresh(original.refreshToken());

        assertThat(first.refreshToken()).isEqualTo(original.refreshToken());
        assertThat(second.refreshToken()).isEqualTo(original.refreshToken());
        assertThat(tokenService.validate(second.accessToken(), TokenType.ACCESS).subject()).isEqualTo("u1");
    }

    @Test
    void logoutRevokesBothTokens() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");

        tokenService.logout(pair.accessToken(), pair.refreshToken());

        assertThat(tokenService.isRevoked(pair.accessClaims().jti())).isTrue();
        assertThat(tokenService.isRevoked(pair.refreshClaims().jti())).isTrue();
        assertThat(metrics.get("logouts")).isEqualTo(1);
    }

    @Test
    void logoutIgnoresUnusableRefreshToken() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");

        tokenService.logout(pair.accessToken(), "garbage");

        assertThat(tokenService.isRevoked(pair.accessClaims().jti())).isTrue();
    }

    @Test
    void logoutIgnoresRefreshTokenOfAnotherSubject() {
        TokenPair mine = tokenService.issue("u1", "u1@example.com");
        TokenPair theirs = tokenService.issue("u2", "u2@example.com");

        tokenService.logout(mine.accessToken(), theirs.refreshToken());

        assertThat(tokenService.isRevoked(theirs.refreshClaims().jti())).isFalse();
    }

    @Test
    void revocationLookupFailureRejectsToken() {
        RevocationStore broken = mock(RevocationStore.class);
        when(broken.isRevoked(anyString(), any())).thenThrow(new IllegalStateException("store down"));
        TokenService service = newService(broken);
        TokenPair pair = service.issue("u1", "u1@example.com");

        assertThatThrownBy(() -> service.validate(pair.accessToken(), TokenType.ACCESS))
                .isInstanceOf(RevokedTokenException.class);
        assertThat(metrics.get("revocation_lookup_failures")).isEqualTo(1);
    }

    @Test
    void bearerHeaderParsing() {
        assertThat(tokenService.extractBearerToken("Bearer abc.def.ghi")).contains("abc.def.ghi");
        assertThat(tokenService.extractBearerToken("Basic abc")).isEmpty();
        assertThat(tokenService.extractBearerToken("Bearer ")).isEmpty();
        assertThat(tokenService.extractBearerToken(null)).isEmpty();
    }

    @Test
    void purgeDropsExpiredRevocations() {
        TokenPair pair = tokenService.issue("u1", "u1@example.com");
        tokenService.revoke(pair.accessClaims().jti(), pair.accessClaims().expiresAt());

        clock.advance(Duration.ofHours(2));

        assertThat(tokenService.purgeExpiredRevocations()).isEqualTo(1);
        assertThat(revocationStore.size()).isZero();
    }
}
