package com.fieldservice.backend.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request counter of one client.
 *
 * @param windowStart start of the current window
 * @param count       requests counted in the current window
 */
public record RateBucket(Instant windowStart, int count) {

    public Instant resetAt(Duration window) {
        return windowStart.plus(window);
    }

    public boolean isElapsedAt(Instant now, Duration window) {
        return !now.isBefore(resetAt(window));
    }
}
