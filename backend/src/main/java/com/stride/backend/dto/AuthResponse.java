package com.stride.backend.dto;

import com.stride.backend.security.TokenPair;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private String accessToken;
    private String refreshToken;
    @Builder.Default
    private String tokenType = "Bearer";
    private Instant accessTokenExpiresAt;
    private Instant refreshTokenExpiresAt;
    private UserDto user;

    public static AuthResponse of(TokenPair pair, UserDto user) {
        return AuthResponse.builder()
                .accessToken(pair.accessToken())
                .refreshToken(pair.refreshToken())
                .accessTokenExpiresAt(pair.accessClaims().expiresAt())
                .refreshTokenExpiresAt(pair.refreshClaims().expiresAt())
                .user(user)
                .build();
    }
}
