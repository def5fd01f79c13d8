package com.fieldservice.backend.security;

import com.fieldservice.backend.model.AttemptHistory;
import com.fieldservice.backend.store.InMemoryKeyedStateStore;
import com.fieldservice.backend.support.MutableClock;
import com.fieldservice.backend.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoginAttemptTrackerTest {

    private static final String LOGIN = "master01";
    private static final String SOURCE = "10.0.0.7";

    private MutableClock clock;
    private InMemoryKeyedStateStore<AttemptHistory> store;
    private LoginAttemptTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        store = new InMemoryKeyedStateStore<>("login-attempts");
        tracker = new LoginAttemptTracker(store, TestProperties.securityProperties(), clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            tracker.record(LOGIN, SOURCE, false);
        }
    }

    @Nested
    @DisplayName("lockout")
    class Lockout {

        @Test
        @DisplayName("four failures leave the account unlocked")
        void belowThreshold() {
            fail(4);

            assertThat(tracker.isLocked(LOGIN)).isFalse();
            assertThat(tracker.failedCount(LOGIN)).isEqualTo(4);
        }

        @Test
        @DisplayName("the fifth failure locks the account for 30 minutes")
        void reachesThreshold() {
            fail(5);

            assertThat(tracker.isLocked(LOGIN)).isTrue();
            assertThat(tracker.lockedUntil(LOGIN)).contains(clock.instant().plus(Duration.ofMinutes(30)));
        }

        @Test
        @DisplayName("the lock lifts once its period has passed")
        void lockExpires() {
            fail(5);
            clock.advance(Duration.ofMinutes(30).plusSeconds(1));

            assertThat(tracker.isLocked(LOGIN)).isFalse();
            assertThat(tracker.lockedUntil(LOGIN)).isEmpty();
        }

        @Test
        @DisplayName("a failure while locked restarts the lockout period")
        void failureWhileLockedExtends() {
            fail(5);
            clock.advance(Duration.ofMinutes(10));
            Instant secondFailure = clock.instant();
            fail(1);

            assertThat(tracker.lockedUntil(LOGIN)).contains(secondFailure.plus(Duration.ofMinutes(30)));
        }

        @Test
        @DisplayName("failures older than the tracking window do not count")
        void windowed() {
            fail(4);
            clock.advance(Duration.ofHours(1).plusSeconds(1));
            fail(1);

            assertThat(tracker.isLocked(LOGIN)).isFalse();
            assertThat(tracker.failedCount(LOGIN)).isEqualTo(1);
        }

        @Test
        @DisplayName("identities are tracked independently")
        void perIdentity() {
            fail(5);

            assertThat(tracker.isLocked("director02")).isFalse();
            assertThat(tracker.failedCount("director02")).isZero();
        }
    }

    @Nested
    @DisplayName("success and unlock")
    class SuccessAndUnlock {

        @Test
        @DisplayName("one success on a locked account lifts the lock and zeroes the failures")
        void successWhileLockedClears() {
            fail(5);
            assertThat(tracker.isLocked(LOGIN)).isTrue();

            tracker.record(LOGIN, SOURCE, true);

            assertThat(tracker.isLocked(LOGIN)).isFalse();
            assertThat(tracker.failedCount(LOGIN)).isZero();
            assertThat(tracker.lockedUntil(LOGIN)).isEmpty();
        }

        @Test
        @DisplayName("a success resets the failure count")
        void successResets() {
            fail(4);
            tracker.record(LOGIN, SOURCE, true);
            assertThat(tracker.failedCount(LOGIN)).isZero();
            fail(4);

            assertThat(tracker.isLocked(LOGIN)).isFalse();
            assertThat(tracker.failedCount(LOGIN)).isEqualTo(4);
        }

        @Test
        @DisplayName("administrative unlock clears the lock and the failures")
        void unlock() {
            fail(5);

            assertThat(tracker.unlock(LOGIN)).isTrue();
            assertThat(tracker.isLocked(LOGIN)).isFalse();
            assertThat(tracker.failedCount(LOGIN)).isZero();
        }

        @Test
        @DisplayName("unlocking an unknown identity reports false")
        void unlockUnknown() {
            assertThat(tracker.unlock("nobody")).isFalse();
            assertThat(store.get("nobody")).isEmpty();
        }
    }

    @Test
    @DisplayName("purgeStale drops idle unlocked histories and keeps locked ones")
    void purgeStale() {
        tracker.record("idle", SOURCE, false);
        clock.advance(Duration.ofMinutes(61));
        fail(5);

        assertThat(tracker.purgeStale()).isEqualTo(1);
        assertThat(tracker.snapshot()).containsOnlyKeys(LOGIN);
    }

    @Test
    @DisplayName("concurrent failures from many threads are all recorded")
    void concurrentRecording() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.record(LOGIN, SOURCE, false);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        AttemptHistory history = store.get(LOGIN).orElseThrow();
        assertThat(history.totalAttempts()).isEqualTo((long) threads * perThread);
        assertThat(history.attempts()).hasSize(LoginAttemptTracker.MAX_KEPT_ATTEMPTS);
        assertThat(tracker.isLocked(LOGIN)).isTrue();
    }
}
