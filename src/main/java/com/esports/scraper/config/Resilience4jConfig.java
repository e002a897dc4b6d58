package com.esports.scraper.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the {@link RetryRegistry} the fetch layer pulls its page-fetch
 * {@link Retry} instances from. Each retry is built from the run's fetch
 * policy, so the registry starts empty and only contributes shared event
 * logging.
 * </p>
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * Creates the global {@link RetryRegistry}. Every {@link Retry} added to
     * it logs its retries and final failures.
     *
     * @return registry with default configuration and retry logging attached
     */
    @Bean
    public RetryRegistry retryRegistry() {
        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.getEventPublisher().onEntryAdded(event -> attachLogging(event.getAddedEntry()));
        return registry;
    }

    private static void attachLogging(final Retry retry) {
        retry.getEventPublisher()
                .onRetry(e -> log.warn("Retry {} after {}: {}",
                        e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                        e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()))
                .onError(e -> log.warn("Giving up after {} attempts: {}",
                        e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()));
    }

}
