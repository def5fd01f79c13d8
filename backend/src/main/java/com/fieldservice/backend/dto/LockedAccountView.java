package com.fieldservice.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One currently locked identity, as listed by GET /api/v1/security/locked-accounts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LockedAccountView {

    private String  login;
    private String  lastSource;
    private Instant lockedUntil;
    private long    remainingSeconds;
    private long    totalAttempts;
    private long    failedAttempts;
}
