package com.stride.backend.security;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditContext;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuditService;
import com.stride.backend.config.SecurityProperties;
import com.stride.backend.exception.MalformedTokenException;
import com.stride.backend.exception.RevokedTokenException;
import com.stride.backend.exception.TokenException;
import com.stride.backend.exception.WrongTokenTypeException;
import com.stride.backend.metrics.SecurityMetricsCollector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues, validates and revokes bearer tokens.
 *
 * Tokens are self-contained; the only shared state is the revocation set,
 * so validation needs no locking by callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenSigner tokenSigner;
    private final RevocationStore revocationStore;
    private final SecurityProperties securityProperties;
    private final SecurityMetricsCollector securityMetrics;
    private final AuditService auditService;
    private final Clock clock;

    @PostConstruct
    void warnOnRefreshReuse() {
        if (!securityProperties.getJwt().isRotateRefreshTokens()) {
            log.warn("Refresh token rotation is disabled: a leaked refresh token stays usable for its full lifetime ({})",
                    securityProperties.getJwt().getRefreshTtl());
        }
    }

    public TokenPair issue(String subject, String email) {
        TokenClaims access = newClaims(subject, email, TokenType.ACCESS, securityProperties.getJwt().getAccessTtl());
        TokenClaims refresh = newClaims(subject, email, TokenType.REFRESH, securityProperties.getJwt().getRefreshTtl());
        TokenPair pair = new TokenPair(tokenSigner.sign(access), tokenSigner.sign(refresh), access, refresh);
        securityMetrics.increment("tokens_issued");
        log.debug("Issued token pair for subject={} accessJti={} refreshJti={}", subject, access.jti(), refresh.jti());
        return pair;
    }

    /**
     * Verifies signature, expiry, type and revocation, in that order.
     *
     * @throws TokenException describing the first check that failed
     */
    public TokenClaims validate(String token, TokenType expectedType) {
        try {
            TokenClaims claims = verifyType(token, expectedType);
            if (isRevoked(claims.jti())) {
                throw new RevokedTokenException("Token has been revoked");
            }
            return claims;
        } catch (TokenException ex) {
            securityMetrics.increment("token_rejected_" + ex.reasonCode());
            throw ex;
        }
    }

    /**
     * Revocation lookup. If the store cannot answer, the token is treated as
     * revoked.
     */
    public boolean isRevoked(String jti) {
        try {
            return revocationStore.isRevoked(jti, clock.instant());
        } catch (RuntimeException ex) {
            log.error("Revocation lookup failed for jti={}; rejecting token", jti, ex);
            securityMetrics.increment("revocation_lookup_failures");
            return true;
        }
    }

    /**
     * Idempotent. Revoking an already revoked or already expired token does nothing.
     */
    public void revoke(String jti, Instant expiresAt) {
        revokeIfActive(jti, expiresAt);
    }

    /**
     * Exchanges a refresh token for a new access token. With rotation enabled a
     * new refresh token is issued as well and the presented one is revoked, so
     * it can be used only once.
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims presented = validate(refreshToken, TokenType.REFRESH);

        if (!securityProperties.getJwt().isRotateRefreshTokens()) {
            TokenClaims access = newClaims(presented.subject(), presented.email(), TokenType.ACCESS,
                    securityProperties.getJwt().getAccessTtl());
            securityMetrics.increment("tokens_refreshed");
            return new TokenPair(tokenSigner.sign(access), refreshToken, access, presented);
        }

        if (!revokeIfActive(presented.jti(), presented.expiresAt())) {
            // another request consumed this refresh token first
            securityMetrics.increment("refresh_token_reuse");
            auditService.logEvent(AuditAction.SECURITY_SUSPICIOUS_ACTIVITY, "token", AuditOutcome.BLOCKED,
                    AuditContext.builder()
                            .userId(presented.subject())
                            .details(Map.of("activity", "refresh_token_reuse", "jti", presented.jti()))
                            .build());
            throw new RevokedTokenException("Refresh token has already been used");
        }
        TokenPair pair = issue(presented.subject(), presented.email());
        securityMetrics.increment("tokens_refreshed");
        return pair;
    }

    /**
     * Revokes the access token and, best effort, the refresh token. A refresh
     * token that does not verify is ignored rather than failing the logout.
     */
    public void logout(String accessToken, String refreshToken) {
        TokenClaims access = verifyType(accessToken, TokenType.ACCESS);
        revokeIfActive(access.jti(), access.expiresAt());

        if (refreshToken != null && !refreshToken.isBlank()) {
            try {
                TokenClaims refresh = verifyType(refreshToken, TokenType.REFRESH);
                if (!refresh.subject().equals(access.subject())) {
                    log.warn("Ignoring refresh token of another subject during logout subject={}", access.subject());
                } else {
                    revokeIfActive(refresh.jti(), refresh.expiresAt());
                }
            } catch (TokenException ex) {
                log.debug("Ignoring unusable refresh token on logout reason={}", ex.reasonCode());
            }
        }
        securityMetrics.increment("logouts");
    }

    public Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() || token.contains(" ") ? Optional.empty() : Optional.of(token);
    }

    public int purgeExpiredRevocations() {
        int removed = revocationStore.purgeExpired(clock.instant());
        if (removed > 0) {
            log.info("Purged {} expired revocation entries", removed);
        }
        return removed;
    }

    private TokenClaims verifyType(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }
        TokenClaims claims = tokenSigner.verify(token);
        if (claims.type() != expectedType) {
            throw new WrongTokenTypeException("Expected " + expectedType.code() + " token");
        }
        return claims;
    }

    private boolean revokeIfActive(String jti, Instant expiresAt) {
        Instant now = clock.instant();
        if (jti == null || expiresAt == null || !now.isBefore(expiresAt)) {
            return false;
        }
        boolean revoked = revocationStore.revoke(new RevocationEntry(jti, expiresAt), now);
        if (revoked) {
            securityMetrics.increment("tokens_revoked");
            log.debug("Revoked token jti={} until {}", jti, expiresAt);
        }
        return revoked;
    }

    private TokenClaims newClaims(String subject, String email, TokenType type, Duration ttl) {
        // JWT times have second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return new TokenClaims(subject, email, UUID.randomUUID().toString(), type, issuedAt, issuedAt.plus(ttl));
    }
}
