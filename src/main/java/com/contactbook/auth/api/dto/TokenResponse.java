package com.contactbook.auth.api.dto;

import com.contactbook.auth.token.TokenPair;

import java.time.Instant;

public record TokenResponse(
        String accessToken,
        Instant accessTokenExpiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt,
        String tokenType
) {

    public static TokenResponse bearer(TokenPair tokenPair) {
        return new TokenResponse(tokenPair.accessToken(), tokenPair.accessTokenExpiresAt(),
                tokenPair.refreshToken(), tokenPair.refreshTokenExpiresAt(), "bearer");
    }
}
