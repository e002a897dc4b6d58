package com.esports.scraper.model;

import java.util.Comparator;

/**
 * Where the current value of a canonical field came from.
 */
public record FieldSource(PageType pageType, int ordinal, String url) {

    /**
     * Total order used to resolve conflicts: higher page precedence first, then
     * the lower discovery ordinal, then the URL.
     */
    public static final Comparator<FieldSource> AUTHORITY =
            Comparator.comparingInt((FieldSource s) -> -s.pageType().precedence())
                    .thenComparingInt(FieldSource::ordinal)
                    .thenComparing(FieldSource::url);

    public static FieldSource of(final NormalizedFields fields) {
        return new FieldSource(fields.pageType(), fields.ordinal(), fields.sourceUrl());
    }
}
