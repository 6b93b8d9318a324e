package com.turdes.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Sign-up payload. Carries no role; every new account starts as a plain user.
 */
public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @Size(max = 32) String phone,
        @NotBlank(message = "password is required") String password
) {
}
