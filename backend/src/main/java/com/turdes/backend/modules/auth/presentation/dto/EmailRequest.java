package com.turdes.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of the endpoints that only take an address: resend verification and request password reset.
 */
public record EmailRequest(@NotBlank(message = "email is required") String email) {
}
