package com.esports.scraper.model;

/**
 * Two equal-precedence sources disagreed on a field; {@code kept} won the
 * tie-break and {@code rejected}, read from {@code rejectedSource}, was dropped.
 *
 * @param level page type both sources share
 */
public record FieldDiscrepancy(String field, String kept, String rejected, String rejectedSource, PageType level) {

    public FieldDiscrepancy withKept(final String value) {
        return new FieldDiscrepancy(field, value, rejected, rejectedSource, level);
    }
}
