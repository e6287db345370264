package com.stride.backend.security;

public record TokenPair(
        String accessToken,
        String refreshToken,
        TokenClaims accessClaims,
        TokenClaims refreshClaims
) {
}
