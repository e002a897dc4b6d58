package com.esports.scraper.service.normalize;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>Date/time normalizer</h2>
 *
 * <p>Turns the date and time strings the upstream prints into UTC instants.
 * Formats are tried in a fixed order and the first one that parses wins:</p>
 * <ol>
 *   <li>the machine timestamp of match pages, <code>2024-07-14 18:00:00</code> (UTC);</li>
 *   <li>ISO-8601 with offset, then ISO local date-time;</li>
 *   <li>listing day headers with and without weekday, long and short month,
 *       e.g. <code>Sun, July 14, 2024</code>, <code>Jul 14, 2024</code>;</li>
 *   <li>ISO date.</li>
 * </ol>
 * <p>Local values are read in the configured upstream zone. A date without a
 * usable time (blank or <code>TBD</code>) resolves to the start of that day.</p>
 */
@Slf4j
public class DateTimeNormalizer {

    private static final DateTimeFormatter UTC_TIMESTAMP = formatter("yyyy-MM-dd HH:mm:ss");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("EEE, MMMM d, yyyy"),
            formatter("EEE, MMM d, yyyy"),
            formatter("EEEE, MMMM d, yyyy"),
            formatter("MMMM d, yyyy"),
            formatter("MMM d, yyyy"),
            formatter("d MMMM yyyy"),
            formatter("d MMM yyyy"),
            DateTimeFormatter.ISO_LOCAL_DATE,
            formatter("yyyy/MM/dd"));

    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
            formatter("h:mm a"),
            formatter("h:mma"),
            formatter("H:mm"));

    private static final Pattern RELATIVE_DAY = Pattern.compile("(?i)\\b(today|yesterday|tomorrow)\\b");
    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(?i)(\\d{1,2})(st|nd|rd|th)\\b");
    private static final Pattern TRAILING_ZONE = Pattern.compile("\\s+[A-Z]{2,5}$");
    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s*(?:\\s-\\s|\\u2014|\\u2013|\\s+to\\s+)\\s*");
    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");

    private final ZoneId zone;

    public DateTimeNormalizer(final ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Parses the upstream's UTC timestamp attribute.
     */
    public Optional<OffsetDateTime> parseUtcTimestamp(@Nullable final String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(raw.trim(), UTC_TIMESTAMP).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return parseIso(raw.trim());
        }
    }

    /**
     * Combines a date and an optional time of day, both in the upstream zone,
     * into a UTC instant.
     */
    public Optional<OffsetDateTime> parseLocal(@Nullable final String date, @Nullable final String time) {
        String d = cleanDate(date);
        if (d == null) {
            return Optional.empty();
        }
        Optional<OffsetDateTime> iso = parseIso(d);
        if (iso.isPresent()) {
            return iso;
        }
        return parseDate(d).map(day -> parseTime(time)
                .map(day::atTime)
                .orElseGet(day::atStartOfDay)
                .atZone(zone)
                .withZoneSameInstant(ZoneOffset.UTC)
                .toOffsetDateTime());
    }

    /**
     * Splits an event's date range. Only the start is required; a missing
     * start year is borrowed from the end.
     */
    public DateRange parseRange(@Nullable final String raw) {
        if (StringUtils.isBlank(raw)) {
            return new DateRange(Optional.empty(), Optional.empty());
        }
        String[] parts = RANGE_SEPARATOR.split(normalizeSpace(raw), 2);
        String start = parts[0];
        String end = parts.length > 1 ? parts[1] : null;
        if (end != null && !YEAR.matcher(start).find()) {
            Matcher year = YEAR.matcher(end);
            if (year.find()) {
                start = start + ", " + year.group(1);
            }
        }
        Optional<OffsetDateTime> startAt = parseLocal(start, null);
        Optional<LocalDate> endDate = Optional.ofNullable(cleanDate(end)).flatMap(this::parseDate);
        return new DateRange(startAt, endDate);
    }

    /**
     * Start instant and optional end day of an event.
     */
    public record DateRange(Optional<OffsetDateTime> start, Optional<LocalDate> end) {
    }

    Optional<LocalDate> parseDate(final String text) {
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, f));
            } catch (DateTimeParseException ex) {
                log.trace("'{}' is not {}", text, f);
            }
        }
        return Optional.empty();
    }

    Optional<LocalTime> parseTime(@Nullable final String raw) {
        if (StringUtils.isBlank(raw) || "tbd".equalsIgnoreCase(raw.trim())) {
            return Optional.empty();
        }
        String t = TRAILING_ZONE.matcher(normalizeSpace(raw)).replaceAll("");
        for (DateTimeFormatter f : TIME_FORMATS) {
            try {
                return Optional.of(LocalTime.parse(t, f));
            } catch (DateTimeParseException ex) {
                log.trace("'{}' is not {}", t, f);
            }
        }
        return Optional.empty();
    }

    private static Optional<OffsetDateTime> parseIso(final String text) {
        try {
            return Optional.of(OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    @Nullable
    private static String cleanDate(@Nullable final String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String s = RELATIVE_DAY.matcher(raw).replaceAll("");
        s = ORDINAL_SUFFIX.matcher(s).replaceAll("$1");
        return StringUtils.trimToNull(normalizeSpace(s));
    }

    private static String normalizeSpace(final String s) {
        return StringUtils.normalizeSpace(s.replace('\u00A0', ' '));
    }

    private static DateTimeFormatter formatter(final String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
