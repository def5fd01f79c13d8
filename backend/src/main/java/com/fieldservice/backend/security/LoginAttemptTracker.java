package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.model.AttemptHistory;
import com.fieldservice.backend.model.LoginAttempt;
import com.fieldservice.backend.store.KeyedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * LoginAttemptTracker records login outcomes per identity and derives the lock state.
 *
 * <ul>
 *   <li>An identity is locked once its consecutive failures inside the tracking window
 *       reach the threshold; every further failure while at or above the threshold
 *       restarts the lockout period.</li>
 *   <li>One success clears the failures and the lock.</li>
 *   <li>Each identity's history is updated in a single atomic store operation, so
 *       concurrent attempts never lose a record and readers see whole histories.</li>
 * </ul>
 */
@Slf4j
@Component
public class LoginAttemptTracker {

    /** Upper bound on attempts kept per identity inside the window. */
    static final int MAX_KEPT_ATTEMPTS = 100;

    private final KeyedStateStore<AttemptHistory> store;
    private final int                             threshold;
    private final Duration                        lockoutDuration;
    private final Duration                        trackingWindow;
    private final Clock                           clock;

    public LoginAttemptTracker(KeyedStateStore<AttemptHistory> attemptStore,
                               SecurityProperties properties,
                               Clock clock) {
        this.store           = attemptStore;
        this.threshold       = properties.getLockout().getThreshold();
        this.lockoutDuration = properties.getLockout().getDuration();
        this.trackingWindow  = properties.getLockout().getTrackingWindow();
        this.clock           = clock;
    }

    /**
     * Appends an attempt and re-evaluates the lock for the identity.
     */
    public void record(String identity, String source, boolean success) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(trackingWindow);
        LoginAttempt attempt = new LoginAttempt(identity, source, now, success);

        AttemptHistory updated = store.update(identity, current -> {
            AttemptHistory history = (current == null ? AttemptHistory.empty() : current)
                    .append(attempt, cutoff, MAX_KEPT_ATTEMPTS);
            if (success) {
                return history.cleared();
            }
            if (history.consecutiveFailures(cutoff) >= threshold) {
                return history.lockUntil(now.plus(lockoutDuration));
            }
            return history;
        });

        if (success) {
            log.info("Successful login for '{}' from {}", identity, source);
        } else if (updated.isLockedAt(now)) {
            log.warn("Failed login for '{}' from {}; account locked until {} ({} consecutive failures)",
                    identity, source, updated.lockedUntil(), updated.consecutiveFailures(cutoff));
        } else {
            log.warn("Failed login for '{}' from {}", identity, source);
        }
    }

    /**
     * @return true while the identity's lockout is active
     */
    public boolean isLocked(String identity) {
        Instant now = clock.instant();
        return store.get(identity)
                .map(history -> history.isLockedAt(now))
                .orElse(false);
    }

    /**
     * @return failures since the last success, inside the tracking window
     */
    public int failedCount(String identity) {
        Instant cutoff = clock.instant().minus(trackingWindow);
        return store.get(identity)
                .map(history -> history.consecutiveFailures(cutoff))
                .orElse(0);
    }

    /**
     * @return end of the active lockout, if any
     */
    public Optional<Instant> lockedUntil(String identity) {
        Instant now = clock.instant();
        return store.get(identity)
                .filter(history -> history.isLockedAt(now))
                .map(AttemptHistory::lockedUntil);
    }

    /**
     * Administrative unlock: lifts the lock and forgets the identity's failures.
     *
     * @return true if the identity had recorded state
     */
    public boolean unlock(String identity) {
        AttemptHistory updated = store.update(identity, current -> current == null ? null : current.cleared());
        if (updated != null) {
            log.info("Account '{}' unlocked by administrator", identity);
        }
        return updated != null;
    }

    /**
     * Point-in-time view of every tracked identity.
     */
    public Map<String, AttemptHistory> snapshot() {
        return store.snapshot();
    }

    /**
     * Drops histories with no attempt inside the window and no active lock.
     *
     * @return number of identities removed
     */
    public int purgeStale() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(trackingWindow);
        return store.evictIf((identity, history) -> history.isStale(cutoff, now));
    }

    public Duration getTrackingWindow() {
        return trackingWindow;
    }
}
