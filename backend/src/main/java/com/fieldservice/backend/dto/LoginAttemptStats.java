package com.fieldservice.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of the login attempts currently tracked.
 * Returned by GET /api/v1/security/login-attempts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LoginAttemptStats {

    private long   totalAttempts;
    private long   successfulAttempts;
    private long   failedAttempts;
    private int    lockedAccounts;
    private int    uniqueSources;
    private double successRate;            // percent, 0 when nothing was recorded

    private List<RecentAttempt> recentAttempts;   // newest first, at most 20

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RecentAttempt {
        private String  login;
        private String  source;            // masked client address
        private boolean success;
        private Instant timestamp;
    }
}
