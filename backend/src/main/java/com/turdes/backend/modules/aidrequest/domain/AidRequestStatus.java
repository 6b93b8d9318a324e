package com.turdes.backend.modules.aidrequest.domain;

public enum AidRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    DELIVERED
}
