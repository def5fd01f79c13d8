package com.fieldservice.backend.service;

import com.fieldservice.backend.security.CsrfGuard;
import com.fieldservice.backend.security.LoginAttemptTracker;
import com.fieldservice.backend.security.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically drops security state that can no longer affect a decision:
 * expired CSRF tokens, stale attempt histories and elapsed rate buckets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityStateCleanupService {

    private final CsrfGuard           csrfGuard;
    private final LoginAttemptTracker loginAttemptTracker;
    private final RateLimiter         rateLimiter;

    @Scheduled(fixedRateString = "${security.cleanup.interval-ms:300000}",
               initialDelayString = "${security.cleanup.interval-ms:300000}")
    public void purgeExpired() {
        int csrfTokens = csrfGuard.purgeExpired();
        int histories  = loginAttemptTracker.purgeStale();
        int buckets    = rateLimiter.purgeElapsed();
        if (csrfTokens + histories + buckets > 0) {
            log.info("Security state cleanup: {} CSRF tokens, {} attempt histories, {} rate buckets removed",
                    csrfTokens, histories, buckets);
        } else {
            log.debug("Security state cleanup: nothing to remove");
        }
    }
}
