package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.exception.SecurityError;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * TokenService handles all access-token operations:
 * - Issuing signed JWS tokens (default TTL from configuration, overridable per call)
 * - Verifying signature, algorithm, issuer, expiry and required claims
 * - Refusing to start with a missing, placeholder or too-short signing secret
 *
 * Verification never throws: every failure collapses into an empty result so callers
 * cannot tell an expired token from a forged one. The reason is logged at DEBUG.
 */
@Slf4j
@Component
public class TokenService {

    static final String USER_ID_CLAIM   = "user_id";
    static final String USER_TYPE_CLAIM = "user_type";
    static final String ROLE_CLAIM      = "role";

    private static final Set<String> EXAMPLE_SECRETS = Set.of(
            "your-secret-key-here",
            "your-very-secure-secret-key-here-min-32-chars",
            "changeme"
    );

    private final SecretKey    signingKey;
    private final MacAlgorithm algorithm;
    private final String       issuer;
    private final Duration     defaultTtl;
    private final Clock        clock;
    private final JwtParser    parser;

    public TokenService(SecurityProperties properties, Clock clock) {
        SecurityProperties.Jwt jwt = properties.getJwt();
        this.algorithm  = resolveAlgorithm(jwt.getAlgorithm());
        this.signingKey = buildSigningKey(jwt.getSecret(), algorithm);
        this.issuer     = jwt.getIssuer();
        this.defaultTtl = Duration.ofMinutes(jwt.getAccessTokenExpireMinutes());
        this.clock      = clock;
        this.parser     = Jwts.parser()
                .verifyWith(signingKey)
                .requireIssuer(issuer)
                .clock(() -> Date.from(clock.instant()))
                .build();
        log.info("Token service ready (algorithm={}, ttl={}m)", algorithm.getId(), defaultTtl.toMinutes());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Issuance
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Issues a token with the configured default lifetime.
     */
    public String issue(AccessTokenClaims claims) {
        return issue(claims, defaultTtl);
    }

    /**
     * Issues a token that expires {@code ttl} from now.
     */
    public String issue(AccessTokenClaims claims, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token TTL must be positive");
        }
        Instant now = clock.instant();
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .subject(claims.subject())
                .claim(USER_ID_CLAIM, claims.userId())
                .claim(USER_TYPE_CLAIM, claims.userType())
                .claim(ROLE_CLAIM, claims.role())
                .id(tokenId)
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, algorithm)
                .compact();

        log.debug("Issued access token jti={} for '{}'", tokenId, claims.subject());
        return token;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Verification
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Verifies a token.
     *
     * @param token compact JWS string
     * @return the decoded token, or empty if it is invalid or expired
     */
    public Optional<VerifiedToken> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Jws<Claims> jws = parser.parseSignedClaims(token);
            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                log.debug("Token rejected: unexpected algorithm {}", jws.getHeader().getAlgorithm());
                return Optional.empty();
            }
            return decode(jws.getPayload());
        } catch (ExpiredJwtException e) {
            log.debug("Token rejected ({}): expired at {}", SecurityError.TOKEN_EXPIRED, e.getClaims().getExpiration());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected ({}): {}", SecurityError.TOKEN_INVALID, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<VerifiedToken> decode(Claims payload) {
        String subject  = payload.getSubject();
        Number userId   = payload.get(USER_ID_CLAIM, Number.class);
        String userType = payload.get(USER_TYPE_CLAIM, String.class);
        String role     = payload.get(ROLE_CLAIM, String.class);
        String tokenId  = payload.getId();
        Date issuedAt   = payload.getIssuedAt();
        Date expiresAt  = payload.getExpiration();

        if (subject == null || userId == null || userType == null || role == null
                || tokenId == null || issuedAt == null || expiresAt == null) {
            log.debug("Token rejected: required claim missing");
            return Optional.empty();
        }
        if (issuedAt.toInstant().isAfter(clock.instant())) {
            log.debug("Token rejected: issued in the future (jti={})", tokenId);
            return Optional.empty();
        }
        return Optional.of(new VerifiedToken(
                new AccessTokenClaims(subject, userId.longValue(), userType, role),
                tokenId,
                issuedAt.toInstant(),
                expiresAt.toInstant(),
                payload.getIssuer()
        ));
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Startup validation
    // ─────────────────────────────────────────────────────────────────────────

    private static MacAlgorithm resolveAlgorithm(String id) {
        String normalized = id == null ? "" : id.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalStateException(
                        "Unsupported JWT signing algorithm '" + id + "' (expected HS256, HS384 or HS512)");
        }
    }

    private static SecretKey buildSigningKey(String secret, MacAlgorithm algorithm) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be null or blank (set JWT_SECRET_KEY)");
        }
        if (secret.contains("${")) {
            throw new IllegalStateException(
                    "JWT secret still contains a placeholder; the environment variable is not set");
        }
        if (EXAMPLE_SECRETS.contains(secret)) {
            throw new IllegalStateException("JWT secret is an example value; generate a real one");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        int minBytes = algorithm.getKeyBitLength() / Byte.SIZE;
        if (keyBytes.length < minBytes) {
            throw new IllegalStateException(
                    "JWT secret is too short for " + algorithm.getId() + ": at least " + minBytes
                            + " bytes required, got " + keyBytes.length);
        }
        // HS256 -> HmacSHA256
        return new SecretKeySpec(keyBytes, "HmacSHA" + algorithm.getId().substring(2));
    }
}
