package com.fieldservice.backend.auth;

import com.fieldservice.backend.exception.AuthenticationFailedException;
import com.fieldservice.backend.exception.SecurityError;
import com.fieldservice.backend.model.UserAccount;
import com.fieldservice.backend.security.AccessTokenClaims;
import com.fieldservice.backend.security.CredentialVerifier;
import com.fieldservice.backend.security.LoginAttemptTracker;
import com.fieldservice.backend.security.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * AuthService runs the login flow.
 * - A locked identity is refused before its password is looked at
 * - Unknown logins and wrong passwords are indistinguishable to the caller
 * - Every outcome of a real verification is recorded with the tracker
 */
@Slf4j
@Service
public class AuthService {

    private final UserAccountLookup   userAccountLookup;
    private final CredentialVerifier  credentialVerifier;
    private final LoginAttemptTracker loginAttemptTracker;
    private final TokenService        tokenService;

    // Verified against when the login is unknown, so both paths pay for one BCrypt check.
    private final String dummyDigest;

    public AuthService(UserAccountLookup userAccountLookup,
                       CredentialVerifier credentialVerifier,
                       LoginAttemptTracker loginAttemptTracker,
                       TokenService tokenService) {
        this.userAccountLookup   = userAccountLookup;
        this.credentialVerifier  = credentialVerifier;
        this.loginAttemptTracker = loginAttemptTracker;
        this.tokenService        = tokenService;
        this.dummyDigest         = credentialVerifier.hash(UUID.randomUUID().toString());
    }

    /**
     * Authenticates a login/password pair and issues an access token.
     *
     * @param login    submitted login
     * @param password submitted plaintext password
     * @param source   client address, recorded with the attempt
     * @throws AuthenticationFailedException ACCOUNT_LOCKED, INVALID_CREDENTIALS or INACTIVE_USER
     */
    public LoginResult login(String login, String password, String source) {
        if (loginAttemptTracker.isLocked(login)) {
            log.warn("Login refused for locked account '{}' from {}", login, source);
            throw new AuthenticationFailedException(SecurityError.ACCOUNT_LOCKED);
        }

        Optional<UserAccount> account = userAccountLookup.findByLogin(login);
        String digest = account.map(UserAccount::getPasswordHash).orElse(dummyDigest);
        boolean verified = credentialVerifier.verify(password, digest) && account.isPresent();

        loginAttemptTracker.record(login, source, verified);
        if (!verified) {
            throw new AuthenticationFailedException(SecurityError.INVALID_CREDENTIALS);
        }

        UserAccount user = account.get();
        if (!user.isActive()) {
            log.warn("Login for inactive account '{}'", login);
            throw new AuthenticationFailedException(SecurityError.INACTIVE_USER);
        }

        AccessTokenClaims claims = new AccessTokenClaims(
                user.getLogin(), user.getId(), user.getUserType(), user.getRole());
        String token = tokenService.issue(claims);
        return new LoginResult(user, token, tokenService.getDefaultTtl());
    }

    /**
     * Loads the account behind an authenticated request.
     *
     * @throws AuthenticationFailedException TOKEN_INVALID if the account is gone,
     *                                       INACTIVE_USER if it was deactivated
     */
    public UserAccount currentAccount(long userId) {
        UserAccount account = userAccountLookup.findById(userId)
                .orElseThrow(() -> new AuthenticationFailedException(SecurityError.TOKEN_INVALID));
        if (!account.isActive()) {
            throw new AuthenticationFailedException(SecurityError.INACTIVE_USER);
        }
        return account;
    }
}
