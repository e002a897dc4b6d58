package com.esports.scraper.service.fetch;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.model.RenderMode;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds the per-run {@link PageFetcher}: a fresh rate gate, a fresh cookie
 * jar and a fresh browser pool, bound to the run's {@link FetchPolicy}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageFetcherFactory {

    private static final long MIN_BACKOFF_MILLIS = 1L;

    private final ScraperProperties props;

    private final WebClient.Builder webClientBuilder;

    private final RetryRegistry retryRegistry;

    private final Supplier<WebDriver> webDriverFactory;

    private final Clock clock;

    /**
     * @param policy             retry, pacing and timeout settings of the run
     * @param browserConcurrency browser renders allowed at once
     * @param browserSlotWait    how long a browser fetch may wait for a slot
     */
    public PageFetcher create(final FetchPolicy policy, final int browserConcurrency, final Duration browserSlotWait) {
        URI upstream = URI.create(props.getUpstream().getBaseUrl());
        String runTag = UUID.randomUUID().toString().substring(0, 8);

        Bulkhead bulkhead = Bulkhead.of("browser-" + runTag, BulkheadConfig.custom()
                .maxConcurrentCalls(browserConcurrency)
                .maxWaitDuration(browserSlotWait)
                .build());

        log.debug("Fetcher {} for {}: {}", runTag, upstream.getHost(), policy);
        return new PageFetcher(upstream, policy, new HostRateGate(policy.minRequestInterval()),
                openTransports(browserConcurrency, browserSlotWait), bulkhead, retryFor(policy));
    }

    /**
     * One transport per render mode. The browser pool opens sessions lazily,
     * so runs that never render pay nothing for it.
     */
    protected Map<RenderMode, PageTransport> openTransports(final int browserConcurrency,
                                                            final Duration browserSlotWait) {
        ScraperProperties.Browser browser = props.getBrowser();
        Map<RenderMode, PageTransport> transports = new EnumMap<>(RenderMode.class);
        transports.put(RenderMode.HTTP,
                new HttpPageTransport(webClientBuilder, props.getUpstream().getUserAgent(), clock));
        transports.put(RenderMode.BROWSER, new BrowserPageTransport(
                new BrowserSessionPool(webDriverFactory, browserConcurrency),
                browser.getReadySelectors(), browser.getSettleTime(), browserSlotWait, clock));
        return transports;
    }

    /**
     * Retries are shared between runs with an identical policy; the registry
     * keys them by the policy's value.
     */
    Retry retryFor(final FetchPolicy policy) {
        String name = "page-fetch " + policy;
        return retryRegistry.retry(name, () -> retryConfig(policy));
    }

    static RetryConfig retryConfig(final FetchPolicy policy) {
        long initial = Math.max(MIN_BACKOFF_MILLIS, policy.initialBackoff().toMillis());
        double multiplier = Math.max(1.0, policy.backoffMultiplier());
        double jitter = Math.min(0.99, Math.max(0.0, policy.jitter()));
        IntervalFunction backoff = jitter > 0
                ? IntervalFunction.ofExponentialRandomBackoff(initial, multiplier, jitter)
                : IntervalFunction.ofExponentialBackoff(initial, multiplier);
        return RetryConfig.custom()
                .maxAttempts(policy.retryLimit())
                .intervalFunction(backoff)
                .retryOnException(ex -> ex instanceof FetchException fe && fe.isTransientFailure())
                .failAfterMaxAttempts(false)
                .build();
    }
}
