package com.esports.scraper.service.fetch;

import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.RawPage;

import java.time.Duration;

/**
 * One way of turning a URL into markup. Implementations make exactly one
 * attempt; retrying and pacing belong to {@link PageFetcher}.
 */
public interface PageTransport extends AutoCloseable {

    /**
     * @param target  page to retrieve
     * @param timeout upper bound for this attempt
     * @return the complete page
     * @throws FetchException on any failure
     */
    RawPage fetch(FetchTarget target, Duration timeout);

    @Override
    default void close() {
    }
}
