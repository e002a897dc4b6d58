package com.esports.scraper.model;

import org.springframework.lang.Nullable;

/**
 * Rounds won by each side on one map of a match.
 */
public record MapScore(int order, String name, @Nullable Integer score1, @Nullable Integer score2) {
}
