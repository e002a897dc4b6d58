package com.esports.scraper.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * One page the orchestrator wants retrieved. Immutable once issued.
 *
 * @param url            absolute upstream URL
 * @param template       page layout, which fixes the page type
 * @param renderMode     retrieval mode chosen for the template
 * @param ordinal        deterministic discovery rank, used as the merge tie-break
 * @param parentRecordId id of the listing-derived record a detail page enriches
 */
public record FetchTarget(
        String url,
        PageTemplate template,
        RenderMode renderMode,
        int ordinal,
        @Nullable String parentRecordId
) {

    public FetchTarget {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(renderMode, "renderMode");
    }

    public static FetchTarget of(final String url, final PageTemplate template,
                                 final RenderMode renderMode, final int ordinal) {
        return new FetchTarget(url, template, renderMode, ordinal, null);
    }

    public PageType pageType() {
        return template.pageType();
    }
}
