package com.fieldservice.backend.auth;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /api/v1/auth/login
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @JsonAlias("identity")
    @NotBlank(message = "Login is required")
    @Size(max = 100, message = "Login is too long")
    private String login;

    @NotBlank(message = "Password is required")
    @Size(max = 128, message = "Password is too long")
    private String password;
}
