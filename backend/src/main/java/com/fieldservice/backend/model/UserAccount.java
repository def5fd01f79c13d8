package com.fieldservice.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * An account that can log in: masters, employees and administrators alike.
 * Only the fields the authentication layer needs; the full profiles belong to the
 * CRUD layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    public static final String STATUS_ACTIVE = "active";

    private Long id;
    private String login;
    private String passwordHash;      // BCrypt digest, never plaintext
    private String userType;          // e.g. "master", "director", "admin"
    private String role;              // authorization role, e.g. "admin", "manager"
    private String status;            // "active" or "inactive"
    private Long cityId;              // null for administrators
    private LocalDateTime createdAt;

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }
}
