package com.fieldservice.backend.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable login-attempt history of one identity, as held in the attempt store.
 *
 * @param attempts      attempts inside the tracking window, oldest first
 * @param lockedUntil   end of the current lockout, or null when not locked
 * @param totalAttempts attempts ever recorded for this identity (not pruned)
 */
public record AttemptHistory(List<LoginAttempt> attempts, Instant lockedUntil, long totalAttempts) {

    public AttemptHistory {
        attempts = List.copyOf(attempts);
    }

    public static AttemptHistory empty() {
        return new AttemptHistory(List.of(), null, 0);
    }

    /**
     * Appends an attempt, dropping attempts at or before {@code cutoff} and keeping at
     * most {@code maxKept} of the newest.
     */
    public AttemptHistory append(LoginAttempt attempt, Instant cutoff, int maxKept) {
        List<LoginAttempt> kept = new ArrayList<>(attempts.size() + 1);
        for (LoginAttempt existing : attempts) {
            if (existing.timestamp().isAfter(cutoff)) {
                kept.add(existing);
            }
        }
        kept.add(attempt);
        if (kept.size() > maxKept) {
            kept = kept.subList(kept.size() - maxKept, kept.size());
        }
        return new AttemptHistory(kept, lockedUntil, totalAttempts + 1);
    }

    /**
     * Failures since the most recent success, counting only those after {@code cutoff}.
     */
    public int consecutiveFailures(Instant cutoff) {
        int count = 0;
        for (int i = attempts.size() - 1; i >= 0; i--) {
            LoginAttempt attempt = attempts.get(i);
            if (attempt.success() || !attempt.timestamp().isAfter(cutoff)) {
                break;
            }
            count++;
        }
        return count;
    }

    public long failuresAfter(Instant cutoff) {
        return attempts.stream()
                .filter(a -> !a.success() && a.timestamp().isAfter(cutoff))
                .count();
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }

    public AttemptHistory lockUntil(Instant until) {
        return new AttemptHistory(attempts, until, totalAttempts);
    }

    /** Lifts the lock and forgets recorded failures; successes stay for reporting. */
    public AttemptHistory cleared() {
        List<LoginAttempt> successes = attempts.stream().filter(LoginAttempt::success).toList();
        return new AttemptHistory(successes, null, totalAttempts);
    }

    /** True when nothing in this history is still relevant at {@code now}. */
    public boolean isStale(Instant cutoff, Instant now) {
        return !isLockedAt(now) && attempts.stream().noneMatch(a -> a.timestamp().isAfter(cutoff));
    }

    public LoginAttempt lastAttempt() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }
}
