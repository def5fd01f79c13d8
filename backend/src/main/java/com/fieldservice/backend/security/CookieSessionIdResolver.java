package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * Keeps the session id in an httpOnly {@code session_id} cookie.
 */
@Component
public class CookieSessionIdResolver implements SessionIdResolver {

    public static final String COOKIE_NAME = "session_id";

    private final SecureRandom random = new SecureRandom();
    private final Duration     maxAge;
    private final boolean      secure;

    public CookieSessionIdResolver(SecurityProperties properties) {
        this.maxAge = Duration.ofMinutes(properties.getJwt().getAccessTokenExpireMinutes());
        this.secure = properties.isCookieSecure();
    }

    @Override
    public Optional<String> resolve(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> COOKIE_NAME.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(value -> value != null && !value.isBlank())
                .findFirst();
    }

    @Override
    public String establish(HttpServletRequest request, HttpServletResponse response) {
        return resolve(request).orElseGet(() -> rotate(response));
    }

    @Override
    public String rotate(HttpServletResponse response) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String sessionId = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        writeCookie(response, sessionId, maxAge);
        return sessionId;
    }

    @Override
    public void clear(HttpServletResponse response) {
        writeCookie(response, "", Duration.ZERO);
    }

    private void writeCookie(HttpServletResponse response, String value, Duration age) {
        ResponseCookie cookie = ResponseCookie.from(COOKIE_NAME, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path("/")
                .maxAge(age)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
