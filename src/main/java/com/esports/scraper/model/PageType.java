package com.esports.scraper.model;

/**
 * Coarse page kind. Detail pages carry richer, authoritative data and
 * therefore outrank listing pages when field values conflict.
 */
public enum PageType {

    LISTING(0),
    DETAIL(1);

    private final int precedence;

    PageType(final int precedence) {
        this.precedence = precedence;
    }

    public int precedence() {
        return precedence;
    }

    public boolean outranks(final PageType other) {
        return precedence > other.precedence;
    }
}
