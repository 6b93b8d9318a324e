package com.turdes.backend.global.security;

import com.turdes.backend.modules.auth.domain.Role;

/**
 * Verified identity attached to every authenticated request.
 */
public record JwtAuthenticationPrincipal(Long userId, String email, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
