package com.fieldservice.backend.security;

import com.fieldservice.backend.config.SecurityProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the client address used as rate-limit key and recorded with login attempts.
 *
 * Trusted proxy headers are checked in the configured order; for X-Forwarded-For the
 * first (client-most) hop wins. Without any of them the socket address is used.
 */
@Component
public class ClientIpResolver {

    private final List<String> trustedHeaders;

    public ClientIpResolver(SecurityProperties properties) {
        this.trustedHeaders = properties.getTrustedProxyHeaders();
    }

    public String resolve(HttpServletRequest request) {
        for (String header : trustedHeaders) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                String ip = value.split(",")[0].trim();
                if (!ip.isEmpty()) {
                    return ip;
                }
            }
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? "unknown" : remote;
    }

    /**
     * Masks the last two octets of an IPv4 address for logging.
     */
    public static String mask(String ip) {
        if (ip == null || ip.isBlank()) {
            return "null";
        }
        String[] parts = ip.split("\\.");
        if (parts.length != 4) {
            return "***";
        }
        return parts[0] + "." + parts[1] + ".***.***";
    }
}
