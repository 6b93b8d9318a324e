package com.turdes.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

/**
 * Domain failure with a stable machine {@code code} and a human-readable {@code detail}.
 */
public class ProblemException extends ResponseStatusException {

    private final ProblemKind kind;
    private final String code;
    private final String detail;

    public ProblemException(ProblemKind kind, String code, String detail) {
        super(kind.status(), code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public ProblemKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
