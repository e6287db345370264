package com.stride.backend.security;

import com.stride.backend.exception.ExpiredTokenException;
import com.stride.backend.exception.InvalidSignatureException;
import com.stride.backend.exception.MalformedTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Date;

/**
 * HS256 JWT signer backed by JJWT.
 */
@Slf4j
public class JwtTokenSigner implements TokenSigner {

    static final String EMAIL_CLAIM = "email";
    static final String TYPE_CLAIM = "type";

    private final SecretKey signingKey;
    private final String issuer;
    private final String audience;
    private final JwtParser parser;

    public JwtTokenSigner(SecretKey signingKey, String issuer, String audience, Clock clock) {
        this.signingKey = signingKey;
        this.issuer = issuer;
        this.audience = audience;
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public String sign(TokenClaims claims) {
        return Jwts.builder()
                .id(claims.jti())
                .subject(claims.subject())
                .claim(EMAIL_CLAIM, claims.email())
                .claim(TYPE_CLAIM, claims.type() == null ? null : claims.type().code())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    @Override
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            return toTokenClaims(claims);
        } catch (ExpiredJwtException ex) {
            throw new ExpiredTokenException("Token has expired", ex);
        } catch (SecurityException ex) {
            throw new InvalidSignatureException("Token signature is invalid", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new MalformedTokenException("Token is malformed: " + ex.getMessage(), ex);
        }
    }

    private TokenClaims toTokenClaims(Claims claims) {
        if (claims.getSubject() == null || claims.getId() == null
                || claims.getIssuedAt() == null || claims.getExpiration() == null) {
            throw new MalformedTokenException("Token is missing required claims");
        }
        TokenType type = TokenType.fromCode(claims.get(TYPE_CLAIM, String.class)).orElse(null);
        try {
            return new TokenClaims(
                    claims.getSubject(),
                    claims.get(EMAIL_CLAIM, String.class),
                    claims.getId(),
                    type,
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant());
        } catch (IllegalArgumentException ex) {
            throw new MalformedTokenException("Token claims are inconsistent", ex);
        }
    }
}
