package com.esports.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;

/**
 * A start time normalized to UTC, or {@code unknown} with the raw upstream
 * text kept for diagnostics.
 *
 * @param value UTC timestamp, {@code null} when unknown
 * @param raw   the upstream text the value was parsed from
 */
public record ScheduledTime(@Nullable OffsetDateTime value, @Nullable String raw) {

    public static final String UNKNOWN = "unknown";

    public static ScheduledTime of(final OffsetDateTime value, final String raw) {
        return new ScheduledTime(value, raw);
    }

    public static ScheduledTime unknown(@Nullable final String raw) {
        return new ScheduledTime(null, raw);
    }

    @JsonIgnore
    public boolean isKnown() {
        return value != null;
    }

    @Override
    public String toString() {
        return value != null ? value.toString() : UNKNOWN;
    }
}
