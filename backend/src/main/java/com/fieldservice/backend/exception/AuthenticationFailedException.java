package com.fieldservice.backend.exception;

import lombok.Getter;

/**
 * Thrown by the auth endpoints' service layer to abort a request with one of the
 * {@link SecurityError} kinds. Converted to an HTTP response by
 * {@link GlobalExceptionHandler}; never escapes the web layer.
 */
@Getter
public class AuthenticationFailedException extends RuntimeException {

    private final SecurityError error;

    public AuthenticationFailedException(SecurityError error) {
        super(error.getMessage());
        this.error = error;
    }
}
