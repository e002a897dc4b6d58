package com.esports.scraper.model;

import java.util.Locale;

/**
 * The fixed set of upstream page layouts the pipeline understands.
 * <p>
 * Each template pins the {@link RecordType} it produces and its
 * {@link PageType}; parsers are registered per template, never chosen by
 * sniffing the markup.
 * </p>
 */
public enum PageTemplate {

    EVENT_LISTING(RecordType.EVENT, PageType.LISTING),
    EVENT_DETAIL(RecordType.EVENT, PageType.DETAIL),
    MATCH_LISTING(RecordType.MATCH, PageType.LISTING),
    MATCH_DETAIL(RecordType.MATCH, PageType.DETAIL);

    private final RecordType recordType;

    private final PageType pageType;

    PageTemplate(final RecordType recordType, final PageType pageType) {
        this.recordType = recordType;
        this.pageType = pageType;
    }

    public RecordType recordType() {
        return recordType;
    }

    public PageType pageType() {
        return pageType;
    }

    /**
     * The detail template that enriches records found on this listing template.
     *
     * @throws IllegalStateException when called on a detail template
     */
    public PageTemplate detailTemplate() {
        return switch (this) {
            case EVENT_LISTING -> EVENT_DETAIL;
            case MATCH_LISTING -> MATCH_DETAIL;
            default -> throw new IllegalStateException(this + " is not a listing template");
        };
    }

    /** Kebab-case key used in configuration ({@code match-detail}). */
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
