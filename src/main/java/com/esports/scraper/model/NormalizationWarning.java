package com.esports.scraper.model;

import org.springframework.lang.Nullable;

/**
 * Non-fatal problem found while normalizing one field.
 */
public record NormalizationWarning(String field, @Nullable String raw, String message) {
}
