package com.fieldservice.backend.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * CredentialVerifier hashes and checks passwords.
 * - Every call to {@link #hash} yields a fresh salted BCrypt digest
 * - {@link #verify} answers with a boolean only; a mismatch is never an exception
 * - The final digest comparison inside BCrypt is constant-time
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialVerifier {

    private final PasswordEncoder passwordEncoder;

    /**
     * Hashes a plaintext password for storage.
     *
     * @param rawPassword plaintext password, must not be empty
     * @return salted digest (includes algorithm id and cost)
     */
    public String hash(String rawPassword) {
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        return passwordEncoder.encode(rawPassword);
    }

    /**
     * Checks a plaintext password against a stored digest.
     *
     * @return true iff {@code rawPassword} produced {@code digest}; false for empty
     *         input or a digest that is not a BCrypt hash
     */
    public boolean verify(String rawPassword, String digest) {
        if (rawPassword == null || rawPassword.isEmpty() || digest == null || digest.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(rawPassword, digest);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password digest could not be parsed: {}", e.getMessage());
            return false;
        }
    }
}
