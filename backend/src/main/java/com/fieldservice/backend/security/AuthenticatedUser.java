package com.fieldservice.backend.security;

import java.security.Principal;

/**
 * Principal placed in the SecurityContext by {@link JwtAuthFilter}.
 *
 * @param userId   account id from the token
 * @param login    account login ("sub")
 * @param userType account kind
 * @param role     authorization role
 * @param tokenId  id of the token that authenticated this request
 */
public record AuthenticatedUser(long userId, String login, String userType, String role, String tokenId)
        implements Principal {

    public static AuthenticatedUser from(VerifiedToken token) {
        AccessTokenClaims claims = token.claims();
        return new AuthenticatedUser(
                claims.userId(), claims.subject(), claims.userType(), claims.role(), token.tokenId());
    }

    @Override
    public String getName() {
        return login;
    }
}
