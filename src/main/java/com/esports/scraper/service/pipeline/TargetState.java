package com.esports.scraper.service.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one fetch target within a run.
 */
public enum TargetState {

    PENDING,
    FETCHING,
    FETCHED,
    FAILED,
    PARSING,
    PARSED,
    PARSE_FAILED,
    SKIPPED;

    public Set<TargetState> next() {
        return switch (this) {
            case PENDING -> EnumSet.of(FETCHING, SKIPPED);
            case FETCHING -> EnumSet.of(FETCHED, FAILED);
            case FETCHED -> EnumSet.of(PARSING);
            case PARSING -> EnumSet.of(PARSED, PARSE_FAILED);
            default -> EnumSet.noneOf(TargetState.class);
        };
    }

    public boolean canMoveTo(final TargetState to) {
        return next().contains(to);
    }

    public boolean isTerminal() {
        return next().isEmpty();
    }
}
