package com.fieldservice.backend.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.AbstractJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Runs every JSON or text body written by a controller (including error bodies from
 * {@code GlobalExceptionHandler}) through the {@link ResponseSanitizer}.
 *
 * JSON bodies are converted to a Jackson tree first, so DTO field names and nested
 * values are sanitized exactly as they will be serialized.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class SanitizingResponseBodyAdvice implements ResponseBodyAdvice<Object> {

    private final ResponseSanitizer sanitizer;
    private final ObjectMapper      objectMapper;

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return AbstractJackson2HttpMessageConverter.class.isAssignableFrom(converterType)
                || StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(Object body,
                                  MethodParameter returnType,
                                  MediaType selectedContentType,
                                  Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  ServerHttpRequest request,
                                  ServerHttpResponse response) {
        if (body == null) {
            return null;
        }
        if (AbstractJackson2HttpMessageConverter.class.isAssignableFrom(selectedConverterType)) {
            JsonNode tree = objectMapper.valueToTree(body);
            return sanitizer.sanitize(tree);
        }
        return sanitizer.sanitize(body);
    }
}
