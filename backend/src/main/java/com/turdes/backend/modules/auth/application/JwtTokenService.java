package com.turdes.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.turdes.backend.global.config.AuthProperties;
import com.turdes.backend.modules.auth.domain.AppUser;
import com.turdes.backend.modules.auth.domain.Role;
import com.turdes.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;
import com.turdes.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private final JwtSigningKeyProvider keyProvider;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(JwtSigningKeyProvider keyProvider, AuthProperties properties, Clock clock) {
        this.keyProvider = keyProvider;
        this.issuer = properties.jwt().issuer();
        this.accessTokenTtl = properties.jwt().accessTokenTtl();
        this.refreshTokenTtl = properties.jwt().refreshTokenTtl();
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(AppUser user) {
        Instant now = clock.instant();
        String accessToken = sign(user, TokenType.ACCESS, now, accessTokenTtl);
        String refreshToken = sign(user, TokenType.REFRESH, now, refreshTokenTtl);
        return new TokenPairResponse(
                accessToken,
                refreshToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtl.toSeconds()
        );
    }

    /**
     * Verifies signature, issuer, expiry and token type. Never throws for a bad token.
     */
    public TokenVerification verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            return new TokenVerification.Rejected("empty token");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String tokenType = claims.get(CLAIM_TOKEN_TYPE, String.class);
            if (!expectedType.getClaimValue().equals(tokenType)) {
                return new TokenVerification.Rejected("unexpected token type " + tokenType);
            }
            if (claims.getExpiration() == null) {
                return new TokenVerification.Rejected("missing expiry");
            }
            Long userId = Long.valueOf(claims.getSubject());
            Role role = Role.fromCode(claims.get(CLAIM_ROLE, String.class));
            Instant expiresAt = claims.getExpiration().toInstant();
            return new TokenVerification.Verified(new TokenClaims(
                    userId,
                    claims.get(CLAIM_EMAIL, String.class),
                    role,
                    expectedType,
                    expiresAt
            ));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected {} token: {}", expectedType.getClaimValue(), e.getClass().getSimpleName());
            return new TokenVerification.Rejected(e.getClass().getSimpleName());
        }
    }

    private String sign(AppUser user, TokenType type, Instant now, Duration ttl) {
        SecretKey key = keyProvider.getSecretKey();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(issuer)
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().getCode())
                .claim(CLAIM_TOKEN_TYPE, type.getClaimValue())
                .signWith(key, SIG.HS256)
                .compact();
    }
}
