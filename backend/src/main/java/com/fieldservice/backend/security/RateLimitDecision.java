package com.fieldservice.backend.security;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of counting one request against a client's window (immutable).
 *
 * <p>Every decision carries what the rate-limit headers need, allowed or not.
 *
 * @param allowed   whether the request may proceed
 * @param limit     requests permitted per window
 * @param remaining requests left in the current window, or -1 when unknown (fail-open)
 * @param resetAt   when the current window ends
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, Instant resetAt) {

    /**
     * Decision used when the bucket store failed and the limiter is configured to fail open.
     */
    public static RateLimitDecision failOpen(int limit, Instant resetAt) {
        return new RateLimitDecision(true, limit, -1, resetAt);
    }

    /**
     * Whole seconds until the window resets, never negative.
     */
    public long retryAfterSeconds(Instant now) {
        long millis = Duration.between(now, resetAt).toMillis();
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }
}
