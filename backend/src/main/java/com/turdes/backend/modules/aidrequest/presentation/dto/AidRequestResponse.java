package com.turdes.backend.modules.aidrequest.presentation.dto;

import java.time.OffsetDateTime;

import com.turdes.backend.modules.aidrequest.domain.AidRequest;
import com.turdes.backend.modules.aidrequest.domain.AidRequestStatus;

public record AidRequestResponse(
        Long id,
        Long ownerId,
        String type,
        String description,
        AidRequestStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static AidRequestResponse from(AidRequest request) {
        return new AidRequestResponse(
                request.getId(),
                request.getOwnerId(),
                request.getType(),
                request.getDescription(),
                request.getStatus(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
