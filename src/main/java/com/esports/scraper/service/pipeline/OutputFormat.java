package com.esports.scraper.service.pipeline;

/**
 * Shape of a run's output for the consumer.
 */
public enum OutputFormat {

    /** Flat rows, one per record, for the dashboard grid. */
    TABLE,

    /** The canonical records themselves, in id order. */
    SEQUENCE
}
