package com.turdes.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable authentication settings bound from {@code auth.*} once at startup.
 *
 * <p>Every flow that needs a secret, a TTL or the frontend link base receives this record through its
 * constructor; nothing reads the environment per call.</p>
 */
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
        @DefaultValue Jwt jwt,
        @DefaultValue Verification verification,
        @DefaultValue Password password,
        @DefaultValue Mail mail,
        @DefaultValue("http://localhost:3000") String frontendBaseUrl
) {

    /**
     * @param secret          HMAC-SHA256 key, Base64 or raw UTF-8; at least 32 bytes
     * @param issuer          {@code iss} claim written to and required from every token
     * @param accessTokenTtl  lifetime of access tokens
     * @param refreshTokenTtl lifetime of refresh tokens
     */
    public record Jwt(
            String secret,
            @DefaultValue("turdes") String issuer,
            @DefaultValue("15m") Duration accessTokenTtl,
            @DefaultValue("7d") Duration refreshTokenTtl
    ) {
    }

    /**
     * @param tokenTtl     lifetime of an e-mail verification token
     * @param resendLimit  resend-verification calls a single caller may make per window
     * @param resendWindow length of the resend throttle window
     */
    public record Verification(
            @DefaultValue("30m") Duration tokenTtl,
            @DefaultValue("3") int resendLimit,
            @DefaultValue("5m") Duration resendWindow
    ) {
    }

    /**
     * @param resetTokenTtl          lifetime of a password reset token
     * @param minLength              minimum accepted length for a new password
     * @param bcryptStrength         BCrypt cost factor
     * @param revokeSessionsOnChange clear the stored refresh token whenever the password changes
     */
    public record Password(
            @DefaultValue("1h") Duration resetTokenTtl,
            @DefaultValue("6") int minLength,
            @DefaultValue("10") int bcryptStrength,
            @DefaultValue("false") boolean revokeSessionsOnChange
    ) {
    }

    public record Mail(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("noreply@turdes.org") String from
    ) {
    }
}
