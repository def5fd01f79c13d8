package com.fieldservice.backend.auth;

import com.fieldservice.backend.model.UserAccount;
import com.fieldservice.backend.security.CredentialVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Creates accounts and owns their credentials: passwords are hashed here and only
 * the digest is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository     userRepository;
    private final CredentialVerifier credentialVerifier;

    /**
     * Registers a new account. Validates login uniqueness and hashes the password.
     *
     * @param login       unique login
     * @param rawPassword plain text password (will be BCrypt hashed)
     * @param userType    account kind ("master", "director", "admin", ...)
     * @param role        authorization role
     * @return the saved account
     * @throws IllegalArgumentException if the login is already taken
     */
    public UserAccount createUser(String login, String rawPassword, String userType, String role) {
        if (userRepository.existsByLogin(login)) {
            throw new IllegalArgumentException("An account with this login already exists.");
        }

        UserAccount account = UserAccount.builder()
                .login(login)
                .passwordHash(credentialVerifier.hash(rawPassword))
                .userType(userType)
                .role(role)
                .status(UserAccount.STATUS_ACTIVE)
                .createdAt(LocalDateTime.now())
                .build();

        return userRepository.save(account);
    }

    /**
     * Replaces the stored credential of an existing account.
     *
     * @throws IllegalArgumentException if the account does not exist
     */
    public void changePassword(String login, String newRawPassword) {
        UserAccount account = userRepository.findByLogin(login)
                .orElseThrow(() -> new IllegalArgumentException("Unknown account: " + login));
        account.setPasswordHash(credentialVerifier.hash(newRawPassword));
        userRepository.save(account);
        log.info("Password changed for: {}", login);
    }
}
