package com.stride.backend.security;

import java.time.Instant;
import java.util.Objects;

/**
 * Claims carried by a signed bearer token. {@code type} is null when the token
 * carried no recognised type claim.
 */
public record TokenClaims(
        String subject,
        String email,
        String jti,
        TokenType type,
        Instant issuedAt,
        Instant expiresAt
) {

    public TokenClaims {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(jti, "jti");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
