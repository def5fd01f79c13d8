package com.fieldservice.backend.security;

import java.time.Instant;

/**
 * Outcome of a successful token verification: the identity claims plus the
 * registered claims the token service added at issuance.
 */
public record VerifiedToken(
        AccessTokenClaims claims,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt,
        String issuer) {
}
