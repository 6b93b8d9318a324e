package com.turdes.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
