package com.fieldservice.backend.auth;

import com.fieldservice.backend.model.UserAccount;

import java.time.Duration;

/**
 * Successful outcome of {@link AuthService#login}.
 */
public record LoginResult(UserAccount account, String accessToken, Duration expiresIn) {
}
