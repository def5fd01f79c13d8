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

/**
 * Rejects requests whose declared Content-Length exceeds the configured ceiling (413).
 */
@Slf4j
@RequiredArgsConstructor
public class RequestSizeLimitFilter extends OncePerRequestFilter {

    private final long                maxSize;
    private final ErrorResponseWriter errorResponseWriter;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         filterChain
    ) throws ServletException, IOException {
        long contentLength = request.getContentLengthLong();
        if (contentLength > maxSize) {
            log.warn("Request body too large: {} bytes (limit {}) for {} {}",
                    contentLength, maxSize, request.getMethod(), request.getRequestURI());
            errorResponseWriter.write(response, SecurityError.PAYLOAD_TOO_LARGE);
            return;
        }
        filterChain.doFilter(request, response);
    }
}
