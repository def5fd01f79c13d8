package com.fieldservice.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Enables Spring's @Scheduled support for the periodic purge of security state
 * (expired CSRF tokens, stale login-attempt histories, elapsed rate buckets).
 *
 * Also exposes the {@link Clock} every time-dependent security component reads,
 * so tests can drive expiry without sleeping.
 */
@EnableScheduling
@Configuration
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("security-sweep-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
