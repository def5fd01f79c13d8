package com.fieldservice.backend.auth;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.model.UserAccount;
import com.fieldservice.backend.security.AuthenticatedUser;
import com.fieldservice.backend.security.ClientIpResolver;
import com.fieldservice.backend.security.CsrfGuard;
import com.fieldservice.backend.security.JwtAuthFilter;
import com.fieldservice.backend.security.SessionIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * AuthController exposes the authentication endpoints:
 *
 *  POST /api/v1/auth/login      → verify credentials, receive access token + CSRF token
 *  POST /api/v1/auth/logout     → clear the session and access-token cookies
 *  GET  /api/v1/auth/csrf-token → CSRF token for the caller's session
 *  GET  /api/v1/auth/me         → account behind the presented access token
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService        authService;
    private final CsrfGuard          csrfGuard;
    private final SessionIdResolver  sessionIdResolver;
    private final ClientIpResolver   clientIpResolver;
    private final SecurityProperties securityProperties;

    // ── POST /api/v1/auth/login ───────────────────────────────────────────

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest,
                                               HttpServletResponse httpResponse) {
        String source = clientIpResolver.resolve(httpRequest);
        log.info("Login attempt for '{}' from {}", request.getLogin(), ClientIpResolver.mask(source));

        LoginResult result = authService.login(request.getLogin(), request.getPassword(), source);

        // New session on every login, so a planted session id never carries over
        String sessionId = sessionIdResolver.rotate(httpResponse);
        String csrfToken = csrfGuard.generate(sessionId);
        writeAccessTokenCookie(httpResponse, result.accessToken(), result.expiresIn());

        UserAccount user = result.account();
        return ResponseEntity.ok(
                LoginResponse.builder()
                        .accessToken(result.accessToken())
                        .expiresIn(result.expiresIn().getSeconds())
                        .userId(user.getId())
                        .userType(user.getUserType())
                        .role(user.getRole())
                        .cityId(user.getCityId())
                        .csrfToken(csrfToken)
                        .build()
        );
    }

    // ── POST /api/v1/auth/logout ──────────────────────────────────────────

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest httpRequest,
                                                      HttpServletResponse httpResponse) {
        sessionIdResolver.resolve(httpRequest).ifPresent(csrfGuard::revoke);
        sessionIdResolver.clear(httpResponse);
        writeAccessTokenCookie(httpResponse, "", Duration.ZERO);
        return ResponseEntity.ok(Map.of("message", "Successfully logged out"));
    }

    // ── GET /api/v1/auth/csrf-token ───────────────────────────────────────

    @GetMapping("/csrf-token")
    public ResponseEntity<CsrfTokenResponse> csrfToken(HttpServletRequest httpRequest,
                                                       HttpServletResponse httpResponse) {
        String sessionId = sessionIdResolver.establish(httpRequest, httpResponse);
        return ResponseEntity.ok(new CsrfTokenResponse(csrfGuard.generate(sessionId)));
    }

    // ── GET /api/v1/auth/me ───────────────────────────────────────────────

    @GetMapping("/me")
    public ResponseEntity<CurrentUserResponse> me(@AuthenticationPrincipal AuthenticatedUser principal) {
        UserAccount account = authService.currentAccount(principal.userId());
        return ResponseEntity.ok(
                CurrentUserResponse.builder()
                        .id(account.getId())
                        .login(account.getLogin())
                        .status(account.getStatus())
                        .userType(account.getUserType())
                        .role(account.getRole())
                        .cityId(account.getCityId())
                        .build()
        );
    }

    private void writeAccessTokenCookie(HttpServletResponse response, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(JwtAuthFilter.ACCESS_TOKEN_COOKIE, value)
                .httpOnly(true)
                .secure(securityProperties.isCookieSecure())
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
