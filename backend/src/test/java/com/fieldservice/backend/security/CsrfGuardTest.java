package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.model.CsrfToken;
import com.fieldservice.backend.store.InMemoryKeyedStateStore;
import com.fieldservice.backend.support.MutableClock;
import com.fieldservice.backend.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CsrfGuardTest {

    private MutableClock clock;
    private InMemoryKeyedStateStore<CsrfToken> store;
    private CsrfGuard csrfGuard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        store = new InMemoryKeyedStateStore<>("csrf-tokens");
        SecurityProperties properties = TestProperties.securityProperties();
        csrfGuard = new CsrfGuard(store, properties, clock);
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("a token validates only for the session it was issued to")
        void boundToSession() {
            String token = csrfGuard.generate("S1");

            assertThat(csrfGuard.validate(token, "S1")).isTrue();
            assertThat(csrfGuard.validate(token, "S2")).isFalse();
        }

        @Test
        @DisplayName("tokens stay valid across repeated checks")
        void reusable() {
            String token = csrfGuard.generate("S1");

            assertThat(csrfGuard.validate(token, "S1")).isTrue();
            assertThat(csrfGuard.validate(token, "S1")).isTrue();
        }

        @Test
        @DisplayName("a newer token replaces the older one")
        void supersededToken() {
            String first = csrfGuard.generate("S1");
            String second = csrfGuard.generate("S1");

            assertThat(first).isNotEqualTo(second);
            assertThat(csrfGuard.validate(first, "S1")).isFalse();
            assertThat(csrfGuard.validate(second, "S1")).isTrue();
        }

        @Test
        @DisplayName("an expired token is rejected and removed")
        void expired() {
            String token = csrfGuard.generate("S1");
            clock.advance(Duration.ofHours(1).plusSeconds(1));

            assertThat(csrfGuard.validate(token, "S1")).isFalse();
            assertThat(store.get("S1")).isEmpty();
        }

        @Test
        @DisplayName("empty, null and unknown inputs are rejected")
        void degenerate() {
            String token = csrfGuard.generate("S1");

            assertThat(csrfGuard.validate("", "S1")).isFalse();
            assertThat(csrfGuard.validate(null, "S1")).isFalse();
            assertThat(csrfGuard.validate(token, null)).isFalse();
            assertThat(csrfGuard.validate(token, "unknown")).isFalse();
            assertThat(csrfGuard.validate(token + "x", "S1")).isFalse();
        }
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("tokens are URL-safe and carry 256 bits of randomness")
        void shape() {
            String token = csrfGuard.generate("S1");

            assertThat(token).hasSize(43).matches("[A-Za-z0-9_-]+");
        }

        @Test
        @DisplayName("a session id is required")
        void sessionRequired() {
            assertThatThrownBy(() -> csrfGuard.generate(" ")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("purgeExpired removes only expired tokens")
    void purge() {
        csrfGuard.generate("old");
        clock.advance(Duration.ofMinutes(40));
        String fresh = csrfGuard.generate("fresh");
        clock.advance(Duration.ofMinutes(30));

        assertThat(csrfGuard.purgeExpired()).isEqualTo(1);
        assertThat(store.get("old")).isEmpty();
        assertThat(csrfGuard.validate(fresh, "fresh")).isTrue();
    }

    @Test
    @DisplayName("revoke forgets the session's token")
    void revoke() {
        String token = csrfGuard.generate("S1");
        csrfGuard.revoke("S1");

        assertThat(csrfGuard.validate(token, "S1")).isFalse();
    }
}
