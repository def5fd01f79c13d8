package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.model.CsrfToken;
import com.fieldservice.backend.store.KeyedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * CsrfGuard issues and checks per-session anti-forgery tokens.
 *
 * Tokens are random nonces kept in their own store, keyed by session id, so they
 * share nothing with the access-token signing key. Issuing a token for a session
 * replaces that session's previous token.
 */
@Slf4j
@Component
public class CsrfGuard {

    private static final int TOKEN_BYTES = 32;

    private final KeyedStateStore<CsrfToken> store;
    private final Duration                   tokenTtl;
    private final Clock                      clock;
    private final SecureRandom               random = new SecureRandom();

    public CsrfGuard(KeyedStateStore<CsrfToken> csrfTokenStore, SecurityProperties properties, Clock clock) {
        this.store    = csrfTokenStore;
        this.tokenTtl = properties.getCsrf().getTokenTtl();
        this.clock    = clock;
    }

    /**
     * Issues a fresh token for the session, superseding any earlier one.
     *
     * @param sessionId caller's session id
     * @return token value to hand to the client
     */
    public String generate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String value = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        Instant now = clock.instant();
        store.update(sessionId, previous -> new CsrfToken(sessionId, value, now, now.plus(tokenTtl)));
        return value;
    }

    /**
     * @return true only if {@code token} is the current, unexpired token of {@code sessionId}
     */
    public boolean validate(String token, String sessionId) {
        if (token == null || token.isEmpty() || sessionId == null || sessionId.isEmpty()) {
            return false;
        }
        Optional<CsrfToken> stored = store.get(sessionId);
        if (stored.isEmpty()) {
            return false;
        }
        CsrfToken current = stored.get();
        Instant now = clock.instant();
        if (current.isExpiredAt(now)) {
            // only drop it if no newer token was issued meanwhile
            store.update(sessionId, latest -> latest != null && latest.isExpiredAt(now) ? null : latest);
            return false;
        }
        return MessageDigest.isEqual(
                current.value().getBytes(StandardCharsets.US_ASCII),
                token.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Forgets the session's token, if any.
     */
    public void revoke(String sessionId) {
        store.reset(sessionId);
    }

    /**
     * Removes every expired token.
     *
     * @return number of tokens removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        return store.evictIf((sessionId, token) -> token.isExpiredAt(now));
    }
}
