package com.turdes.backend.modules.aidrequest.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAidRequestRequest(
        @NotBlank(message = "type is required") @Size(max = 50) String type,
        @NotBlank(message = "description is required") @Size(max = 2000) String description
) {
}
