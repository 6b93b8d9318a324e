package com.turdes.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ResetPasswordRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "newPassword is required") String newPassword,
        String currentPassword
) {
}
