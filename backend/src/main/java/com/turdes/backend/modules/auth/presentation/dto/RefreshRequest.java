package com.turdes.backend.modules.auth.presentation.dto;

/**
 * Blank tokens are rejected by the service with {@code REFRESH_TOKEN_REQUIRED} rather than by bean validation.
 */
public record RefreshRequest(String refreshToken) {
}
