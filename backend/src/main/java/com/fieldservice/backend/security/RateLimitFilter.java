package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties.FailureMode;
import com.fieldservice.backend.exception.ErrorResponseWriter;
import com.fieldservice.backend.exception.SecurityError;
import com.fieldservice.backend.store.StateStoreException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * RateLimitFilter counts every request against the caller's fixed window.
 *
 * <ol>
 *   <li>Resolve the client address</li>
 *   <li>Count the request with {@link RateLimiter}</li>
 *   <li>Write X-RateLimit-Limit / Remaining / Reset on the response, allowed or not</li>
 *   <li>Over the limit: 429 with Retry-After, chain not continued</li>
 * </ol>
 *
 * If the bucket store fails, the configured {@link FailureMode} decides: fail-open lets
 * the request through without a remaining count, fail-closed answers 503.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String LIMIT_HEADER     = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER     = "X-RateLimit-Reset";

    private final RateLimiter         rateLimiter;
    private final ClientIpResolver    clientIpResolver;
    private final ErrorResponseWriter errorResponseWriter;
    private final FailureMode         failureMode;
    private final Clock               clock;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         filterChain
    ) throws ServletException, IOException {

        String clientIp = clientIpResolver.resolve(request);

        RateLimitDecision decision;
        try {
            decision = rateLimiter.allow(clientIp);
        } catch (StateStoreException e) {
            if (failureMode == FailureMode.FAIL_CLOSED) {
                log.error("Rate limit store unavailable, rejecting request (fail-closed): {}", e.getMessage());
                errorResponseWriter.write(response, HttpStatus.SERVICE_UNAVAILABLE, errorResponseWriter.body(
                        HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable.", "RATE_LIMIT_UNAVAILABLE"));
                return;
            }
            log.warn("Rate limit store unavailable, allowing request (fail-open): {}", e.getMessage());
            decision = RateLimitDecision.failOpen(
                    rateLimiter.getLimit(), clock.instant().plus(rateLimiter.getWindow()));
        }

        addRateLimitHeaders(response, decision);

        if (!decision.allowed()) {
            Instant now = clock.instant();
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds(now)));
            log.warn("[RateLimit-Exceeded] ip={} retryAfter={}s",
                    ClientIpResolver.mask(clientIp), decision.retryAfterSeconds(now));
            errorResponseWriter.write(response, SecurityError.RATE_LIMIT_EXCEEDED);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void addRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        if (decision.remaining() >= 0) {
            response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        }
        response.setHeader(RESET_HEADER, String.valueOf(decision.resetAt().getEpochSecond()));
    }
}
