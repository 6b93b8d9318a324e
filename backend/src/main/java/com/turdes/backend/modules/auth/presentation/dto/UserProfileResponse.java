package com.turdes.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record UserProfileResponse(
        Long userId,
        String email,
        String name,
        String phone,
        String role,
        boolean emailVerified,
        OffsetDateTime createdAt
) {
}
