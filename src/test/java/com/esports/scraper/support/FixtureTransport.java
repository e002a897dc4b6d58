package com.esports.scraper.support;

import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.RawPage;
import com.esports.scraper.service.fetch.FetchException;
import com.esports.scraper.service.fetch.PageTransport;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory transport: serves fixture markup by URL, or throws whatever
 * failure was registered for it. Unknown URLs answer 404.
 */
public class FixtureTransport implements PageTransport {

    private final Map<String, Function<FetchTarget, RawPage>> routes = new ConcurrentHashMap<>();

    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    public FixtureTransport serve(final String url, final String fixture) {
        String html = Fixtures.html(fixture);
        routes.put(url, t -> new RawPage(t, html, Fixtures.FETCHED_AT, 200));
        return this;
    }

    public FixtureTransport fail(final String url, final FetchException failure) {
        routes.put(url, t -> {
            throw failure;
        });
        return this;
    }

    @Override
    public RawPage fetch(final FetchTarget target, final Duration timeout) {
        calls.computeIfAbsent(target.url(), u -> new AtomicInteger()).incrementAndGet();
        Function<FetchTarget, RawPage> route = routes.get(target.url());
        if (route == null) {
            throw FetchException.httpStatus(target.url(), 404, null);
        }
        return route.apply(target);
    }

    public int calls(final String url) {
        AtomicInteger n = calls.get(url);
        return n == null ? 0 : n.get();
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }
}
