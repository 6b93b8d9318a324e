package com.turdes.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyEmailRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "token is required") String token
) {
}
