package com.fieldservice.backend.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Optional;

/**
 * Supplies the stable per-caller session identifier that CSRF tokens are bound to.
 * Owned by the session layer; {@link CookieSessionIdResolver} is the default.
 */
public interface SessionIdResolver {

    /**
     * @return the caller's session id, if the request carries one
     */
    Optional<String> resolve(HttpServletRequest request);

    /**
     * Returns the caller's session id, starting a new session when there is none.
     */
    String establish(HttpServletRequest request, HttpServletResponse response);

    /**
     * Always starts a new session (used after login) and returns its id.
     */
    String rotate(HttpServletResponse response);

    /**
     * Ends the caller's session on the client side.
     */
    void clear(HttpServletResponse response);
}
