package com.fieldservice.backend.support;

import com.fieldservice.backend.config.SecurityProperties;

/**
 * {@link SecurityProperties} with a usable signing secret and cheap hashing.
 */
public final class TestProperties {

    public static final String SECRET = "unit-test-signing-secret-0123456789abcdef";

    private TestProperties() {
    }

    public static SecurityProperties securityProperties() {
        SecurityProperties properties = new SecurityProperties();
        properties.getJwt().setSecret(SECRET);
        properties.getPassword().setBcryptStrength(4);
        return properties;
    }
}
