package com.fieldservice.backend.config;

import com.fieldservice.backend.model.AttemptHistory;
import com.fieldservice.backend.model.CsrfToken;
import com.fieldservice.backend.model.RateBucket;
import com.fieldservice.backend.store.InMemoryKeyedStateStore;
import com.fieldservice.backend.store.KeyedStateStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Stores backing the attempt tracker, the rate limiter and the CSRF guard.
 * Each is process-local; a shared store can replace any of them without touching
 * the components that use it.
 */
@Configuration
public class SecurityStateConfig {

    @Bean
    public KeyedStateStore<AttemptHistory> attemptStore() {
        return new InMemoryKeyedStateStore<>("login-attempts");
    }

    @Bean
    public KeyedStateStore<RateBucket> rateBucketStore() {
        return new InMemoryKeyedStateStore<>("rate-buckets");
    }

    @Bean
    public KeyedStateStore<CsrfToken> csrfTokenStore() {
        return new InMemoryKeyedStateStore<>("csrf-tokens");
    }
}
