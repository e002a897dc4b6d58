package com.esports.scraper.service.pipeline;

/**
 * One page-level failure of a run.
 *
 * @param url     page that failed
 * @param kind    failure kind, e.g. {@code TIMEOUT} or {@code STRUCTURE_MISMATCH}
 * @param message human-readable detail
 */
public record RunError(String url, String kind, String message) {
}
