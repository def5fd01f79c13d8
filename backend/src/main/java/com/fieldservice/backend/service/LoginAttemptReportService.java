package com.fieldservice.backend.service;

import com.fieldservice.backend.dto.LockedAccountView;
import com.fieldservice.backend.dto.LoginAttemptStats;
import com.fieldservice.backend.model.AttemptHistory;
import com.fieldservice.backend.model.LoginAttempt;
import com.fieldservice.backend.security.ClientIpResolver;
import com.fieldservice.backend.security.LoginAttemptTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the administrator views over the attempt tracker's state.
 * Works on a snapshot, so a report is consistent per identity.
 */
@Service
@RequiredArgsConstructor
public class LoginAttemptReportService {

    static final int MAX_RECENT_ATTEMPTS = 20;

    private final LoginAttemptTracker loginAttemptTracker;
    private final Clock               clock;

    public LoginAttemptStats loginAttemptStats() {
        Instant now = clock.instant();
        Map<String, AttemptHistory> snapshot = loginAttemptTracker.snapshot();

        long successful = 0;
        long failed = 0;
        int locked = 0;
        Set<String> sources = new HashSet<>();
        List<LoginAttempt> all = new ArrayList<>();

        for (AttemptHistory history : snapshot.values()) {
            if (history.isLockedAt(now)) {
                locked++;
            }
            for (LoginAttempt attempt : history.attempts()) {
                if (attempt.success()) {
                    successful++;
                } else {
                    failed++;
                }
                sources.add(attempt.source());
                all.add(attempt);
            }
        }

        long total = successful + failed;
        List<LoginAttemptStats.RecentAttempt> recent = all.stream()
                .sorted(Comparator.comparing(LoginAttempt::timestamp).reversed())
                .limit(MAX_RECENT_ATTEMPTS)
                .map(attempt -> LoginAttemptStats.RecentAttempt.builder()
                        .login(attempt.identity())
                        .source(ClientIpResolver.mask(attempt.source()))
                        .success(attempt.success())
                        .timestamp(attempt.timestamp())
                        .build())
                .toList();

        return LoginAttemptStats.builder()
                .totalAttempts(total)
                .successfulAttempts(successful)
                .failedAttempts(failed)
                .lockedAccounts(locked)
                .uniqueSources(sources.size())
                .successRate(total == 0 ? 0.0 : successful * 100.0 / total)
                .recentAttempts(recent)
                .build();
    }

    public List<LockedAccountView> lockedAccounts() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(loginAttemptTracker.getTrackingWindow());

        return loginAttemptTracker.snapshot().entrySet().stream()
                .filter(entry -> entry.getValue().isLockedAt(now))
                .map(entry -> {
                    AttemptHistory history = entry.getValue();
                    LoginAttempt last = history.lastAttempt();
                    return LockedAccountView.builder()
                            .login(entry.getKey())
                            .lastSource(last == null ? null : ClientIpResolver.mask(last.source()))
                            .lockedUntil(history.lockedUntil())
                            .remainingSeconds(Duration.between(now, history.lockedUntil()).getSeconds())
                            .totalAttempts(history.totalAttempts())
                            .failedAttempts(history.failuresAfter(cutoff))
                            .build();
                })
                .sorted(Comparator.comparing(LockedAccountView::getLockedUntil))
                .toList();
    }
}
