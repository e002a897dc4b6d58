package com.esports.scraper.model;

/**
 * Kind of normalized output record.
 */
public enum RecordType {
    EVENT,
    MATCH
}
