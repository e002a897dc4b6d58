package com.esports.scraper.service.merge;

import com.esports.scraper.model.FieldSource;

import java.util.Comparator;

/**
 * Tie-break between two sources of the same page type that disagree on a
 * field value. Both policies are total orders over sources, so the winner
 * never depends on which page finished first.
 */
public enum ConflictPolicy {

    /** The source discovered first (lowest ordinal) keeps its value. */
    FIRST_SEEN(FieldSource.AUTHORITY),

    /** The source discovered last (highest ordinal) overrides. */
    LAST_SEEN(Comparator.comparingInt(FieldSource::ordinal).reversed()
            .thenComparing(FieldSource::url));

    private final Comparator<FieldSource> order;

    ConflictPolicy(final Comparator<FieldSource> order) {
        this.order = order;
    }

    /**
     * @return {@code true} when {@code incoming} beats {@code current}
     */
    public boolean prefers(final FieldSource incoming, final FieldSource current) {
        return order.compare(incoming, current) < 0;
    }
}
