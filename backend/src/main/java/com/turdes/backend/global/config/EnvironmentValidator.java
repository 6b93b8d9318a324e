package com.turdes.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Fails startup when the authentication settings cannot produce safe tokens.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEVELOPMENT_SECRET = "dev-turdes-jwt-secret-change-me-before-deploying";
    private static final int MIN_SECRET_BYTES = 32;

    private final AuthProperties authProperties;

    public EnvironmentValidator(AuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid auth configuration: {}", problem));
            throw new IllegalStateException("Invalid auth configuration: " + String.join("; ", problems));
        }
        log.info("Auth configuration validated (issuer={}, accessTtl={}, refreshTtl={})",
                authProperties.jwt().issuer(),
                authProperties.jwt().accessTokenTtl(),
                authProperties.jwt().refreshTokenTtl());
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        String secret = authProperties.jwt().secret();
        if (!StringUtils.hasText(secret)) {
            problems.add("auth.jwt.secret is required");
        } else {
            if (DEVELOPMENT_SECRET.equals(secret)) {
                problems.add("auth.jwt.secret still holds the development placeholder");
            }
            if (secretLength(secret) < MIN_SECRET_BYTES) {
                problems.add("auth.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
        }
        requirePositive(problems, "auth.jwt.access-token-ttl", authProperties.jwt().accessTokenTtl());
        requirePositive(problems, "auth.jwt.refresh-token-ttl", authProperties.jwt().refreshTokenTtl());
        requirePositive(problems, "auth.verification.token-ttl", authProperties.verification().tokenTtl());
        requirePositive(problems, "auth.password.reset-token-ttl", authProperties.password().resetTokenTtl());
        if (authProperties.jwt().accessTokenTtl() != null && authProperties.jwt().refreshTokenTtl() != null
                && authProperties.jwt().refreshTokenTtl().compareTo(authProperties.jwt().accessTokenTtl()) <= 0) {
            problems.add("auth.jwt.refresh-token-ttl must be longer than auth.jwt.access-token-ttl");
        }
        if (!StringUtils.hasText(authProperties.frontendBaseUrl())) {
            problems.add("auth.frontend-base-url is required");
        }
        return problems;
    }

    private static void requirePositive(List<String> problems, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(key + " must be a positive duration");
        }
    }

    static int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
