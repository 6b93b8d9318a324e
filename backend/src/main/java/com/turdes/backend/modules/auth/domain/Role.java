package com.turdes.backend.modules.auth.domain;

import java.util.Arrays;

/**
 * Account roles. The lowercase code is what gets stored and what clients see.
 */
public enum Role {
    USER("user"),
    ADMIN("admin");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Role fromCode(String code) {
        return Arrays.stream(values())
                .filter(role -> role.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role code: " + code));
    }
}
