package com.turdes.backend.modules.auth.presentation.dto;

public record LogoutRequest(String refreshToken) {
}
