package com.turdes.backend.modules.aidrequest.presentation.dto;

import com.turdes.backend.modules.aidrequest.domain.AidRequestStatus;

import jakarta.validation.constraints.NotNull;

public record UpdateAidRequestStatusRequest(@NotNull(message = "status is required") AidRequestStatus status) {
}
