package com.turdes.backend.modules.auth.presentation.dto;

public record LoginResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        String role,
        Long userId
) {
}
