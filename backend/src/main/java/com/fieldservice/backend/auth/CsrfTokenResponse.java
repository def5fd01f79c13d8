package com.fieldservice.backend.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for GET /api/v1/auth/csrf-token
 */
public record CsrfTokenResponse(@JsonProperty("csrf_token") String csrfToken) {
}
