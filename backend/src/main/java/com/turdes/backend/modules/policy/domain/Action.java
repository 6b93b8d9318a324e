package com.turdes.backend.modules.policy.domain;

public enum Action {
    /** Implies every other action. */
    MANAGE,
    CREATE,
    READ,
    UPDATE,
    DELETE
}
