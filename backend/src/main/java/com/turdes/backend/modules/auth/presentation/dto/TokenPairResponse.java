package com.turdes.backend.modules.auth.presentation.dto;

public record TokenPairResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
