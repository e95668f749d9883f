/**
 * Configuration for repository retry behavior
 *
 * Features:
 * - Retries only transient data-access failures (connection resets, lock timeouts)
 * - Exponential backoff between attempts
 * - Recommendation services never retry; the repositories own this policy
 */
package net.shelfmatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

    @Value("${app.retry.repository.max-attempts:3}")
    private int maxAttempts;

    @Value("${app.retry.repository.initial-backoff-ms:200}")
    private long initialBackoff;

    @Value("${app.retry.repository.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${app.retry.repository.max-backoff-ms:2000}")
    private long maxBackoff;

    /**
     * Creates the retry template shared by the catalog and activity repositories.
     *
     * @return RetryTemplate retrying {@link TransientDataAccessException} with exponential backoff
     */
    @Bean("repositoryRetryTemplate")
    public RetryTemplate repositoryRetryTemplate() {
        return repositoryRetryTemplate(maxAttempts, initialBackoff, backoffMultiplier, maxBackoff);
    }

    public static RetryTemplate repositoryRetryTemplate(int maxAttempts, long initialBackoff,
                                                        double multiplier, long maxBackoff) {
        long initial = Math.max(1L, initialBackoff);
        // builder requires multiplier > 1 and maxInterval > initialInterval
        double effectiveMultiplier = multiplier > 1.0 ? multiplier : 2.0;
        long effectiveMax = Math.max(initial + 1, maxBackoff);
        return RetryTemplate.builder()
            .maxAttempts(Math.max(1, maxAttempts))
            .exponentialBackoff(initial, effectiveMultiplier, effectiveMax)
            .retryOn(TransientDataAccessException.class)
            .traversingCauses()
            .build();
    }
}
