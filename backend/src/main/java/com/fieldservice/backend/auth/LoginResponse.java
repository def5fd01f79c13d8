package com.fieldservice.backend.auth;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body returned after a successful login.
 * Serialized in snake_case: access_token, token_type, expires_in, ...
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LoginResponse {

    private String accessToken;

    @Builder.Default
    private String tokenType = "bearer";

    private long   expiresIn;   // seconds until the access token expires

    private Long   userId;
    private String userType;
    private String role;
    private Long   cityId;
    private String csrfToken;   // bound to the session started by this login
}
