package com.fieldservice.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Settings for the authentication and abuse-protection layer.
 * Every value can be supplied through environment variables (see application.yml).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "security")
public class SecurityProperties {

    @Valid
    @NotNull
    private Jwt jwt = new Jwt();

    @Valid
    @NotNull
    private Password password = new Password();

    @Valid
    @NotNull
    private Lockout lockout = new Lockout();

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    @Valid
    @NotNull
    private Csrf csrf = new Csrf();

    @Valid
    @NotNull
    private Request request = new Request();

    @Valid
    @NotNull
    private BootstrapAdmin bootstrapAdmin = new BootstrapAdmin();

    /**
     * Headers consulted (in order) for the real client address behind a proxy.
     * Empty when the service is reachable without a proxy that overwrites them.
     */
    private List<String> trustedProxyHeaders = List.of("X-Forwarded-For", "X-Real-IP");

    /** Marks the session and access-token cookies Secure (HTTPS only). */
    private boolean cookieSecure = false;

    // ── Access tokens ─────────────────────────────────────────────────────

    @Getter
    @Setter
    public static class Jwt {

        /** Shared HMAC secret. Validated at startup by TokenService. */
        private String secret;

        @NotBlank
        private String algorithm = "HS256";

        @Min(1)
        private long accessTokenExpireMinutes = 30;

        @NotBlank
        private String issuer = "request_management_system";
    }

    // ── Password hashing ──────────────────────────────────────────────────

    @Getter
    @Setter
    public static class Password {

        /** BCrypt log2 cost. */
        @Min(4)
        @Max(31)
        private int bcryptStrength = 12;
    }

    // ── Brute-force lockout ───────────────────────────────────────────────

    @Getter
    @Setter
    public static class Lockout {

        @Min(1)
        private int threshold = 5;

        @NotNull
        private Duration duration = Duration.ofMinutes(30);

        @NotNull
        private Duration trackingWindow = Duration.ofHours(1);
    }

    // ── Rate limiting ─────────────────────────────────────────────────────

    @Getter
    @Setter
    public static class RateLimit {

        private boolean enabled = true;

        @Min(1)
        private int maxRequests = 100;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        /**
         * Behaviour when the bucket store is unavailable. Always set explicitly in
         * application.yml (RATE_LIMIT_FAILURE_MODE).
         */
        @NotNull
        private FailureMode failureMode = FailureMode.FAIL_CLOSED;
    }

    public enum FailureMode {
        FAIL_OPEN,
        FAIL_CLOSED
    }

    // ── CSRF ──────────────────────────────────────────────────────────────

    @Getter
    @Setter
    public static class Csrf {

        @NotNull
        private Duration tokenTtl = Duration.ofHours(1);

        /** Path prefixes exempt from the CSRF check on mutating requests. */
        private List<String> excludedPaths = List.of("/api/v1/auth/login", "/api/v1/health");
    }

    // ── Request limits ────────────────────────────────────────────────────

    @Getter
    @Setter
    public static class Request {

        @Min(1)
        private long maxSize = 10L * 1024 * 1024;
    }

    // ── Optional seeded administrator ─────────────────────────────────────

    @Getter
    @Setter
    public static class BootstrapAdmin {

        private String login;
        private String password;
    }
}
