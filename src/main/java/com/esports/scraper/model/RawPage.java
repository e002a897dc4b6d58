package com.esports.scraper.model;

import java.time.Instant;

/**
 * Raw markup returned by the fetcher for one {@link FetchTarget}.
 *
 * @param target    the target this page answers
 * @param html      complete document markup
 * @param fetchedAt when the response was read
 * @param status    HTTP status, or {@code 200} for a successful browser render
 */
public record RawPage(
        FetchTarget target,
        String html,
        Instant fetchedAt,
        int status
) {

    public String url() {
        return target.url();
    }

    public PageTemplate template() {
        return target.template();
    }
}
