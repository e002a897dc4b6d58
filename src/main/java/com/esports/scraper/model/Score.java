package com.esports.scraper.model;

import org.springframework.lang.Nullable;

/**
 * Series score, one side per participant. Either side may be missing.
 */
public record Score(@Nullable Integer first, @Nullable Integer second) {

    public boolean isEmpty() {
        return first == null && second == null;
    }

    public boolean isComplete() {
        return first != null && second != null;
    }

    @Override
    public String toString() {
        return (first == null ? "-" : first) + ":" + (second == null ? "-" : second);
    }
}
