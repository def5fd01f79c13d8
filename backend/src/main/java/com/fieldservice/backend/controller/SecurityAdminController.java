package com.fieldservice.backend.controller;

import com.fieldservice.backend.dto.LockedAccountView;
import com.fieldservice.backend.exception.ErrorResponseWriter;
import com.fieldservice.backend.dto.LoginAttemptStats;
import com.fieldservice.backend.security.LoginAttemptTracker;
import com.fieldservice.backend.service.LoginAttemptReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * SecurityAdminController exposes the attempt tracker to administrators:
 *
 *  GET  /api/v1/security/login-attempts  → aggregate statistics + recent attempts
 *  GET  /api/v1/security/locked-accounts → identities currently locked
 *  POST /api/v1/security/unlock-account  → lift a lock (?login=...)
 *
 * Role admin is enforced in SecurityConfig.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/security")
@RequiredArgsConstructor
public class SecurityAdminController {

    private final LoginAttemptReportService reportService;
    private final LoginAttemptTracker       loginAttemptTracker;
    private final ErrorResponseWriter       errorResponseWriter;

    // ── GET /api/v1/security/login-attempts ───────────────────────────────

    @GetMapping("/login-attempts")
    public ResponseEntity<LoginAttemptStats> loginAttempts() {
        return ResponseEntity.ok(reportService.loginAttemptStats());
    }

    // ── GET /api/v1/security/locked-accounts ──────────────────────────────

    @GetMapping("/locked-accounts")
    public ResponseEntity<List<LockedAccountView>> lockedAccounts() {
        return ResponseEntity.ok(reportService.lockedAccounts());
    }

    // ── POST /api/v1/security/unlock-account ──────────────────────────────

    @PostMapping("/unlock-account")
    public ResponseEntity<Map<String, Object>> unlockAccount(@RequestParam("login") String login) {
        if (!loginAttemptTracker.unlock(login)) {
            log.info("Unlock requested for untracked account '{}'", login);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(errorResponseWriter.body(HttpStatus.NOT_FOUND, "Account not found or not locked", "NOT_FOUND"));
        }
        return ResponseEntity.ok(Map.of("message", "Account " + login + " has been unlocked"));
    }
}
