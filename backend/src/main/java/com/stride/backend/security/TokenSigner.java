package com.stride.backend.security;

import com.stride.backend.exception.TokenException;

/**
 * Turns claims into a compact signed token and back.
 */
public interface TokenSigner {

    String sign(TokenClaims claims);

    /**
     * Checks the signature and expiry and returns the claims.
     *
     * @throws TokenException with reason {@code MALFORMED}, {@code INVALID_SIGNATURE} or {@code EXPIRED}
     */
    TokenClaims verify(String token);
}
