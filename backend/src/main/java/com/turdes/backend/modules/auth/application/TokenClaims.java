package com.turdes.backend.modules.auth.application;

import java.time.Instant;

import com.turdes.backend.modules.auth.domain.Role;

public record TokenClaims(Long userId, String email, Role role, TokenType type, Instant expiresAt) {
}
