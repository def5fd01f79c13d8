package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.model.RateBucket;
import com.fieldservice.backend.store.InMemoryKeyedStateStore;
import com.fieldservice.backend.support.MutableClock;
import com.fieldservice.backend.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RateLimiterTest {

    private static final String CLIENT = "203.0.113.9";

    private MutableClock clock;
    private InMemoryKeyedStateStore<RateBucket> store;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        store = new InMemoryKeyedStateStore<>("rate-buckets");
        SecurityProperties properties = TestProperties.securityProperties();
        properties.getRateLimit().setMaxRequests(10);
        properties.getRateLimit().setWindow(Duration.ofSeconds(60));
        rateLimiter = new RateLimiter(store, properties, clock);
    }

    @Test
    @DisplayName("ten requests pass with a falling remaining count, the eleventh is refused")
    void limitWithinWindow() {
        Instant windowStart = clock.instant();

        for (int i = 1; i <= 10; i++) {
            RateLimitDecision decision = rateLimiter.allow(CLIENT);
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.remaining()).isEqualTo(10 - i);
            assertThat(decision.limit()).isEqualTo(10);
            assertThat(decision.resetAt()).isEqualTo(windowStart.plusSeconds(60));
        }

        RateLimitDecision eleventh = rateLimiter.allow(CLIENT);
        assertThat(eleventh.allowed()).isFalse();
        assertThat(eleventh.remaining()).isZero();
        assertThat(eleventh.retryAfterSeconds(clock.instant())).isEqualTo(60);
    }

    @Test
    @DisplayName("a new window starts fresh once the old one has elapsed")
    void windowResets() {
        for (int i = 0; i < 11; i++) {
            rateLimiter.allow(CLIENT);
        }
        clock.advance(Duration.ofSeconds(60));

        RateLimitDecision decision = rateLimiter.allow(CLIENT);
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(9);
        assertThat(decision.resetAt()).isEqualTo(clock.instant().plusSeconds(60));
    }

    @Test
    @DisplayName("refused requests do not grow the counter without bound")
    void counterCapped() {
        for (int i = 0; i < 50; i++) {
            rateLimiter.allow(CLIENT);
        }

        assertThat(store.get(CLIENT).orElseThrow().count()).isEqualTo(11);
    }

    @Test
    @DisplayName("clients are counted independently")
    void perClient() {
        for (int i = 0; i < 11; i++) {
            rateLimiter.allow(CLIENT);
        }

        assertThat(rateLimiter.allow("198.51.100.1").allowed()).isTrue();
    }

    @Test
    @DisplayName("purgeElapsed removes only finished windows")
    void purge() {
        rateLimiter.allow("old");
        clock.advance(Duration.ofSeconds(45));
        rateLimiter.allow("recent");
        clock.advance(Duration.ofSeconds(20));

        assertThat(rateLimiter.purgeElapsed()).isEqualTo(1);
        assertThat(store.snapshot()).containsOnlyKeys("recent");
    }
}
