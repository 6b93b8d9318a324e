package com.turdes.backend.modules.auth.application;

/**
 * Outcome of verifying a signed token.
 *
 * <p>{@link Rejected} carries a reason for debug logging only. Callers collapse every rejection into
 * one generic failure so that expired, tampered and malformed tokens look the same from outside.</p>
 */
public sealed interface TokenVerification permits TokenVerification.Verified, TokenVerification.Rejected {

    record Verified(TokenClaims claims) implements TokenVerification {
    }

    record Rejected(String reason) implements TokenVerification {
    }
}
