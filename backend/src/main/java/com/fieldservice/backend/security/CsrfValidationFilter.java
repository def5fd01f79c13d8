package com.fieldservice.backend.security;

import com.fieldservice.backend.exception.ErrorResponseWriter;
import com.fieldservice.backend.exception.SecurityError;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Requires a valid {@code X-CSRF-Token} bound to the caller's session on every
 * state-changing request (POST, PUT, PATCH, DELETE) outside the excluded paths.
 * Missing session, missing token and invalid token all answer 403.
 */
@Slf4j
@RequiredArgsConstructor
public class CsrfValidationFilter extends OncePerRequestFilter {

    public static final String HEADER_NAME = "X-CSRF-Token";

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final CsrfGuard           csrfGuard;
    private final SessionIdResolver   sessionIdResolver;
    private final ErrorResponseWriter errorResponseWriter;
    private final List<String>        excludedPaths;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!MUTATING_METHODS.contains(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        return excludedPaths.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         filterChain
    ) throws ServletException, IOException {

        Optional<String> sessionId = sessionIdResolver.resolve(request);
        String token = request.getHeader(HEADER_NAME);

        String rejection = null;
        if (sessionId.isEmpty()) {
            rejection = "missing session id";
        } else if (token == null || token.isBlank()) {
            rejection = "missing CSRF token";
        } else if (!csrfGuard.validate(token, sessionId.get())) {
            rejection = "invalid CSRF token";
        }

        if (rejection != null) {
            log.warn("CSRF check failed for {} {}: {}", request.getMethod(), request.getRequestURI(), rejection);
            errorResponseWriter.write(response, SecurityError.CSRF_MISMATCH);
            return;
        }

        filterChain.doFilter(request, response);
    }
}
