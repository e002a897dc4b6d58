package com.esports.scraper.service.fetch;

import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.RawPage;
import com.esports.scraper.model.RenderMode;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * <h2>PageFetcher</h2>
 *
 * <p>
 * Retrieves one {@link FetchTarget} and returns its markup, or fails with a
 * {@link FetchException} naming the URL, the failure kind and the number of
 * attempts made.
 * </p>
 *
 * <p>
 * Every attempt passes the run's {@link HostRateGate} before it touches the
 * network. Browser attempts additionally hold a {@link Bulkhead} permit for
 * the duration of the render. The {@link Retry} wraps both, so a retried
 * attempt queues for the gate again:
 * </p>
 * <pre>
 *   retry( bulkhead( gate -&gt; transport.fetch ) )
 * </pre>
 *
 * <p>
 * One instance serves one run. Closing it closes the run's transports and
 * with them any open browser sessions.
 * </p>
 */
@Slf4j
public class PageFetcher implements AutoCloseable {

    private final URI upstream;

    private final FetchPolicy policy;

    private final HostRateGate gate;

    private final Map<RenderMode, PageTransport> transports;

    private final Bulkhead browserBulkhead;

    private final Retry retry;

    public PageFetcher(final URI upstream,
                       final FetchPolicy policy,
                       final HostRateGate gate,
                       final Map<RenderMode, PageTransport> transports,
                       final Bulkhead browserBulkhead,
                       final Retry retry) {
        if (StringUtils.isBlank(upstream.getHost())) {
            throw new IllegalArgumentException("upstream base URL has no host: " + upstream);
        }
        this.upstream = upstream;
        this.policy = policy;
        this.gate = gate;
        this.transports = new EnumMap<>(RenderMode.class);
        this.transports.putAll(transports);
        this.browserBulkhead = browserBulkhead;
        this.retry = retry;
    }

    /**
     * Fetches the target under the run's policy.
     *
     * @throws FetchException when the URL is rejected or every allowed attempt failed
     */
    public RawPage fetch(final FetchTarget target) {
        URI uri = validate(target.url());
        PageTransport transport = transports.get(target.renderMode());
        if (transport == null) {
            throw new IllegalStateException("no transport for render mode " + target.renderMode());
        }

        AtomicInteger attempts = new AtomicInteger();
        Supplier<RawPage> attempt = () -> {
            try {
                gate.acquire(uri.getHost());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw FetchException.interrupted(target.url(), ex);
            }
            try {
                return transport.fetch(target, policy.requestTimeout());
            } catch (FetchException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw FetchException.network(target.url(), ex.toString(), ex);
            }
        };

        Supplier<RawPage> guarded = target.renderMode() == RenderMode.BROWSER
                ? Decorators.ofSupplier(attempt).withBulkhead(browserBulkhead).decorate()
                : attempt;
        Supplier<RawPage> counted = () -> {
            int n = attempts.incrementAndGet();
            if (n > 1) {
                log.debug("Attempt {}/{} for {}", n, policy.retryLimit(), target.url());
            }
            try {
                return guarded.get();
            } catch (BulkheadFullException ex) {
                throw FetchException.renderFailure(target.url(), "no browser slot available", ex);
            }
        };

        try {
            RawPage page = Decorators.ofSupplier(counted).withRetry(retry).decorate().get();
            if (attempts.get() > 1) {
                log.info("Fetched {} after {} attempts", target.url(), attempts.get());
            }
            return page;
        } catch (FetchException ex) {
            throw ex.withAttempts(attempts.get());
        }
    }

    public FetchPolicy policy() {
        return policy;
    }

    /**
     * Resolves an upstream path, or passes an absolute URL through.
     */
    public String resolve(final String pathOrUrl) {
        return upstream.resolve(StringUtils.trimToEmpty(pathOrUrl)).toString();
    }

    @Override
    public void close() {
        transports.values().forEach(t -> {
            try {
                t.close();
            } catch (Exception ex) {
                log.warn("Transport did not close cleanly: {}", ex.getMessage(), ex);
            }
        });
    }

    private URI validate(final String url) {
        URI uri;
        try {
            uri = new URI(StringUtils.trimToEmpty(url));
        } catch (URISyntaxException ex) {
            throw FetchException.malformedUrl(url, ex.getMessage());
        }
        String scheme = StringUtils.lowerCase(uri.getScheme(), Locale.ROOT);
        if (!uri.isAbsolute() || !("http".equals(scheme) || "https".equals(scheme))) {
            throw FetchException.malformedUrl(url, "not an absolute http(s) URL");
        }
        if (StringUtils.isBlank(uri.getHost())) {
            throw FetchException.malformedUrl(url, "missing host");
        }
        if (!uri.getHost().equalsIgnoreCase(upstream.getHost())) {
            throw FetchException.malformedUrl(url, "host is not " + upstream.getHost());
        }
        return uri;
    }
}
