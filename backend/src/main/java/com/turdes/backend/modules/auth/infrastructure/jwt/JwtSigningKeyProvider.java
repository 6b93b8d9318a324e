package com.turdes.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.turdes.backend.global.config.AuthProperties;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * HMAC key for signing tokens. The configured secret may be Base64 or plain text.
 *
 * <p>A missing secret does not fail construction; startup validation reports it instead.</p>
 */
@Component
public class JwtSigningKeyProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtSigningKeyProvider(AuthProperties properties) {
        String secret = properties.jwt().secret();
        this.secretKey = StringUtils.hasText(secret) ? new SecretKeySpec(decode(secret), HMAC_SHA_256) : null;
    }

    static byte[] decode(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    public SecretKey getSecretKey() {
        if (secretKey == null) {
            throw new IllegalStateException("auth.jwt.secret is not configured");
        }
        return secretKey;
    }
}
