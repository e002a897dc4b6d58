package com.esports.scraper.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unnormalized record as found on one page. Field values are raw strings;
 * {@code null} means the field was absent on the page.
 *
 * @param recordId   site-native identifier, when the page exposes one
 * @param template   template of the page the record came from
 * @param fields     raw field values keyed by {@link Fields} names
 * @param sourceUrl  page URL
 * @param ordinal    discovery rank of the source page
 * @param position   index of the record among those parsed from its page
 * @param observedAt fetch time of the source page
 */
public record PartialRecord(
        @Nullable String recordId,
        PageTemplate template,
        Map<String, String> fields,
        String sourceUrl,
        int ordinal,
        int position,
        Instant observedAt
) {

    public PartialRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Creates the single record of a page.
     */
    public static PartialRecord from(final RawPage page,
                                     @Nullable final String recordId,
                                     final Map<String, String> fields) {
        return from(page, 0, recordId, fields);
    }

    /**
     * Creates the record at {@code position} among several cards of a page.
     */
    public static PartialRecord from(final RawPage page,
                                     final int position,
                                     @Nullable final String recordId,
                                     final Map<String, String> fields) {
        return new PartialRecord(recordId, page.template(), fields, page.url(),
                page.target().ordinal(), position, page.fetchedAt());
    }

    @Nullable
    public String field(final String name) {
        return fields.get(name);
    }

    public PageType pageType() {
        return template.pageType();
    }
}
