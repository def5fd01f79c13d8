package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.model.RateBucket;
import com.fieldservice.backend.store.KeyedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window rate limiter keyed by client address.
 *
 * <p>Each call counts one request. When the window of a bucket has elapsed, the bucket
 * restarts at the current instant with a count of one, inside the same atomic store
 * update that evaluates it. Buckets of different clients are independent.
 */
@Slf4j
@Component
public class RateLimiter {

    private final KeyedStateStore<RateBucket> store;
    private final int                         limit;
    private final Duration                    window;
    private final Clock                       clock;

    public RateLimiter(KeyedStateStore<RateBucket> rateBucketStore,
                       SecurityProperties properties,
                       Clock clock) {
        this.store  = rateBucketStore;
        this.limit  = properties.getRateLimit().getMaxRequests();
        this.window = properties.getRateLimit().getWindow();
        this.clock  = clock;
    }

    /**
     * Counts one request for the client.
     *
     * @param clientKey client address
     * @return decision with the header values
     */
    public RateLimitDecision allow(String clientKey) {
        Instant now = clock.instant();
        RateBucket bucket = store.update(clientKey, current -> {
            if (current == null || current.isElapsedAt(now, window)) {
                return new RateBucket(now, 1);
            }
            // cap at limit + 1: enough to keep rejecting without overflowing
            return new RateBucket(current.windowStart(), Math.min(current.count() + 1, limit + 1));
        });

        boolean allowed = bucket.count() <= limit;
        int remaining = Math.max(0, limit - bucket.count());
        return new RateLimitDecision(allowed, limit, remaining, bucket.resetAt(window));
    }

    /**
     * Removes buckets whose window has elapsed; they would be reset on next use anyway.
     *
     * @return number of buckets removed
     */
    public int purgeElapsed() {
        Instant now = clock.instant();
        return store.evictIf((clientKey, bucket) -> bucket.isElapsedAt(now, window));
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
