package com.fieldservice.backend.model;

import java.time.Instant;

/**
 * The single active anti-forgery nonce of one session.
 *
 * @param sessionId session the token is bound to
 * @param value     random URL-safe token value
 * @param issuedAt  issuance time
 * @param expiresAt end of the validity window
 */
public record CsrfToken(String sessionId, String value, Instant issuedAt, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
