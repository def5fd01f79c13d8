package com.fieldservice.backend.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure kinds produced by the authentication and abuse-protection layer, with the
 * HTTP status and the caller-facing message for each. Messages are deliberately
 * generic: they never say which check failed.
 */
@Getter
@RequiredArgsConstructor
public enum SecurityError {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Incorrect login or password."),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "Account temporarily locked due to too many failed login attempts."),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Could not validate credentials."),
    // Rendered exactly like TOKEN_INVALID; kept separate for logs only.
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Could not validate credentials."),
    CSRF_MISMATCH(HttpStatus.FORBIDDEN, "Missing or invalid CSRF token."),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "Not enough permissions."),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later."),
    PAYLOAD_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE, "Request too large."),
    INACTIVE_USER(HttpStatus.BAD_REQUEST, "Inactive user.");

    private final HttpStatus status;
    private final String message;

    /** Public error code; the expired kind is reported as the invalid one. */
    public String code() {
        return this == TOKEN_EXPIRED ? TOKEN_INVALID.name() : name();
    }
}
