package com.fieldservice.backend.auth;

import com.fieldservice.backend.model.UserAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory UserRepository using a thread-safe ConcurrentHashMap.
 * Keyed by login (the unique identifier).
 *
 * NOTE: Data is lost on server restart.
 * The relational user tables of the CRUD layer replace this in production.
 */
@Slf4j
@Repository
public class UserRepository implements UserAccountLookup {

    // login → account
    private final Map<String, UserAccount> store = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<UserAccount> findByLogin(String login) {
        return login == null ? Optional.empty() : Optional.ofNullable(store.get(login));
    }

    @Override
    public Optional<UserAccount> findById(long id) {
        return store.values().stream()
                .filter(account -> account.getId() != null && account.getId() == id)
                .findFirst();
    }

    public boolean existsByLogin(String login) {
        return store.containsKey(login);
    }

    public UserAccount save(UserAccount account) {
        if (account.getId() == null) {
            account.setId(sequence.incrementAndGet());
        }
        store.put(account.getLogin(), account);
        log.info("User saved: {}", account.getLogin());
        return account;
    }
}
