package com.esports.scraper.service.fetch;

import com.esports.scraper.config.ScraperProperties;

import java.time.Duration;

/**
 * Retry, pacing and timeout settings applied to one fetch.
 *
 * @param retryLimit         total attempts, first try included
 * @param minRequestInterval minimum spacing between request starts to one host
 * @param requestTimeout     per-attempt timeout
 * @param initialBackoff     wait before the second attempt
 * @param backoffMultiplier  growth factor of successive waits
 * @param jitter             randomization factor in [0, 1)
 */
public record FetchPolicy(
        int retryLimit,
        Duration minRequestInterval,
        Duration requestTimeout,
        Duration initialBackoff,
        double backoffMultiplier,
        double jitter
) {

    public FetchPolicy {
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retryLimit must be at least 1, was " + retryLimit);
        }
        if (minRequestInterval.isNegative()) {
            throw new IllegalArgumentException("minRequestInterval must not be negative");
        }
    }

    public static FetchPolicy from(final ScraperProperties.Fetch cfg) {
        return new FetchPolicy(cfg.getRetryLimit(), cfg.getMinRequestInterval(), cfg.getRequestTimeout(),
                cfg.getInitialBackoff(), cfg.getBackoffMultiplier(), cfg.getJitter());
    }

    public FetchPolicy withRetryLimit(final int limit) {
        return new FetchPolicy(limit, minRequestInterval, requestTimeout, initialBackoff, backoffMultiplier, jitter);
    }

    public FetchPolicy withRequestTimeout(final Duration timeout) {
        return new FetchPolicy(retryLimit, minRequestInterval, timeout, initialBackoff, backoffMultiplier, jitter);
    }

    public FetchPolicy withMinRequestInterval(final Duration interval) {
        return new FetchPolicy(retryLimit, interval, requestTimeout, initialBackoff, backoffMultiplier, jitter);
    }
}
