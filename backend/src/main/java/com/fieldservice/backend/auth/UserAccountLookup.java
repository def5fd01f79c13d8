package com.fieldservice.backend.auth;

import com.fieldservice.backend.model.UserAccount;

import java.util.Optional;

/**
 * Maps a login to its stored account and credential hash.
 * Owned by the user-management (CRUD) layer; {@link UserRepository} is the
 * in-memory stand-in.
 */
public interface UserAccountLookup {

    Optional<UserAccount> findByLogin(String login);

    Optional<UserAccount> findById(long id);
}
