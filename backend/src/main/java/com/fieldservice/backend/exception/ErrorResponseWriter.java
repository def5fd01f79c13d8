package com.fieldservice.backend.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the uniform JSON error body shared by controllers and servlet filters:
 * {@code {error, errorCode, status, timestamp}}.
 *
 * Filters run before the DispatcherServlet, so they cannot rely on
 * {@link GlobalExceptionHandler}; they write through here instead.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public Map<String, Object> body(HttpStatus status, String message, String errorCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("errorCode", errorCode);
        body.put("status", status.value());
        body.put("timestamp", LocalDateTime.now(clock).toString());
        return body;
    }

    public Map<String, Object> body(SecurityError error) {
        return body(error.getStatus(), error.getMessage(), error.code());
    }

    /**
     * Writes the error straight to the servlet response and commits it.
     */
    public void write(HttpServletResponse response, SecurityError error) throws IOException {
        write(response, error.getStatus(), body(error));
    }

    public void write(HttpServletResponse response, HttpStatus status, Map<String, Object> body)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.flushBuffer();
    }
}
