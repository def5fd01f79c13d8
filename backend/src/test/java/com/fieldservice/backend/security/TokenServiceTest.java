package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import com.fieldservice.backend.support.MutableClock;
import com.fieldservice.backend.support.TestProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenServiceTest {

    private static final AccessTokenClaims CLAIMS = new AccessTokenClaims("master01", 42L, "master", "master");

    private MutableClock clock;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        tokenService = new TokenService(TestProperties.securityProperties(), clock);
    }

    @Nested
    @DisplayName("issue / verify")
    class IssueAndVerify {

        @Test
        @DisplayName("a freshly issued token verifies and carries every claim")
        void roundTrip() {
            // when
            String token = tokenService.issue(CLAIMS);

            // then
            assertThat(token.split("\\.")).hasSize(3);
            VerifiedToken verified = tokenService.verify(token).orElseThrow();
            assertThat(verified.claims()).isEqualTo(CLAIMS);
            assertThat(verified.issuer()).isEqualTo("request_management_system");
            assertThat(verified.tokenId()).isNotBlank();
            assertThat(verified.issuedAt()).isEqualTo(clock.instant());
            assertThat(verified.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
        }

        @Test
        @DisplayName("every token gets its own id")
        void uniqueTokenIds() {
            String first = tokenService.issue(CLAIMS);
            String second = tokenService.issue(CLAIMS);

            assertThat(tokenService.verify(first).orElseThrow().tokenId())
                    .isNotEqualTo(tokenService.verify(second).orElseThrow().tokenId());
        }

        @Test
        @DisplayName("non-positive TTL is refused")
        void nonPositiveTtl() {
            assertThatThrownBy(() -> tokenService.issue(CLAIMS, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> tokenService.issue(CLAIMS, Duration.ofSeconds(-5)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("a token past its expiry is invalid")
        void expired() {
            // given
            String token = tokenService.issue(CLAIMS, Duration.ofSeconds(1));

            // when
            clock.advance(Duration.ofSeconds(2));

            // then
            assertThat(tokenService.verify(token)).isEmpty();
        }

        @Test
        @DisplayName("a token is still valid one second before expiry")
        void notYetExpired() {
            String token = tokenService.issue(CLAIMS);
            clock.advance(Duration.ofMinutes(30).minusSeconds(1));

            assertThat(tokenService.verify(token)).isPresent();
        }

        @Test
        @DisplayName("changing one character of the payload breaks the signature")
        void tamperedPayload() {
            String token = tokenService.issue(CLAIMS);
            String[] parts = token.split("\\.");
            char last = parts[1].charAt(parts[1].length() - 2);
            String payload = parts[1].substring(0, parts[1].length() - 2)
                    + (last == 'A' ? 'B' : 'A')
                    + parts[1].charAt(parts[1].length() - 1);

            assertThat(tokenService.verify(parts[0] + "." + payload + "." + parts[2])).isEmpty();
        }

        @Test
        @DisplayName("a token signed with another key is invalid")
        void otherKey() {
            SecurityProperties other = TestProperties.securityProperties();
            other.getJwt().setSecret("a-completely-different-secret-0123456789");
            String foreign = new TokenService(other, clock).issue(CLAIMS);

            assertThat(tokenService.verify(foreign)).isEmpty();
        }

        @Test
        @DisplayName("a token from another issuer is invalid")
        void otherIssuer() {
            SecurityProperties other = TestProperties.securityProperties();
            other.getJwt().setIssuer("someone_else");
            String foreign = new TokenService(other, clock).issue(CLAIMS);

            assertThat(tokenService.verify(foreign)).isEmpty();
        }

        @Test
        @DisplayName("an unsigned token (alg none) is invalid")
        void unsigned() {
            Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
            String header = encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
            String payload = encoder.encodeToString(
                    ("{\"sub\":\"master01\",\"user_id\":42,\"user_type\":\"master\",\"role\":\"admin\","
                            + "\"iss\":\"request_management_system\",\"jti\":\"x\","
                            + "\"iat\":1740823200,\"exp\":1940823200}").getBytes(StandardCharsets.UTF_8));

            assertThat(tokenService.verify(header + "." + payload + ".")).isEmpty();
        }

        @Test
        @DisplayName("a token issued in the future is invalid")
        void issuedInFuture() {
            Instant now = clock.instant();
            clock.advance(Duration.ofMinutes(10));
            String token = tokenService.issue(CLAIMS);
            clock.set(now);

            assertThat(tokenService.verify(token)).isEmpty();
        }

        @Test
        @DisplayName("a correctly signed token without the role claim is invalid")
        void missingClaim() {
            Instant now = clock.instant();
            String token = Jwts.builder()
                    .subject("master01")
                    .claim("user_id", 42)
                    .claim("user_type", "master")
                    .id("jti-1")
                    .issuer("request_management_system")
                    .issuedAt(Date.from(now))
                    .expiration(Date.from(now.plusSeconds(600)))
                    .signWith(Keys.hmacShaKeyFor(TestProperties.SECRET.getBytes(StandardCharsets.UTF_8)),
                            Jwts.SIG.HS256)
                    .compact();

            assertThat(tokenService.verify(token)).isEmpty();
        }

        @Test
        @DisplayName("garbage, blank and null never throw")
        void garbage() {
            assertThat(tokenService.verify("not-a-token")).isEmpty();
            assertThat(tokenService.verify("")).isEmpty();
            assertThat(tokenService.verify(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("startup validation")
    class StartupValidation {

        private TokenService withSecret(String secret) {
            SecurityProperties properties = TestProperties.securityProperties();
            properties.getJwt().setSecret(secret);
            return new TokenService(properties, clock);
        }

        @Test
        @DisplayName("missing secret")
        void missing() {
            assertThatThrownBy(() -> withSecret(null)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> withSecret("   ")).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("unresolved placeholder")
        void placeholder() {
            assertThatThrownBy(() -> withSecret("${JWT_SECRET_KEY}-padding-padding-padding"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("placeholder");
        }

        @Test
        @DisplayName("documented example value")
        void exampleValue() {
            assertThatThrownBy(() -> withSecret("your-very-secure-secret-key-here-min-32-chars"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("example");
        }

        @Test
        @DisplayName("secret shorter than the algorithm's key size")
        void tooShort() {
            assertThatThrownBy(() -> withSecret("short-secret"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("too short");
        }

        @Test
        @DisplayName("HS512 needs a 64-byte secret")
        void hs512KeySize() {
            SecurityProperties properties = TestProperties.securityProperties();
            properties.getJwt().setAlgorithm("HS512");

            assertThatThrownBy(() -> new TokenService(properties, clock))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("HS512");
        }

        @Test
        @DisplayName("unsupported algorithm")
        void unsupportedAlgorithm() {
            SecurityProperties properties = TestProperties.securityProperties();
            properties.getJwt().setAlgorithm("RS256");

            assertThatThrownBy(() -> new TokenService(properties, clock))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Unsupported");
        }
    }
}
