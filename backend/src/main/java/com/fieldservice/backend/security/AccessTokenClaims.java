package com.fieldservice.backend.security;

/**
 * Identity facts carried inside an access token.
 *
 * @param subject  login of the authenticated account ("sub")
 * @param userId   numeric account id
 * @param userType account kind, e.g. "master", "admin", "director"
 * @param role     authorization role used for access checks
 */
public record AccessTokenClaims(String subject, long userId, String userType, String role) {
}
