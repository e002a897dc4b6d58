package com.esports.scraper.service.normalize;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateTimeNormalizerTest {

    private final DateTimeNormalizer utc = new DateTimeNormalizer(ZoneOffset.UTC);

    @Test
    void testUtcTimestampAttribute() {
        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-14T21:00:00Z")),
                utc.parseUtcTimestamp("2024-07-14 21:00:00"));
        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-14T21:00:00Z")),
                utc.parseUtcTimestamp("2024-07-14T23:00:00+02:00"));
        assertTrue(utc.parseUtcTimestamp("soon").isEmpty());
        assertTrue(utc.parseUtcTimestamp(" ").isEmpty());
    }

    @Test
    void testDayHeaderAndTimeInUpstreamZone() {
        DateTimeNormalizer pacific = new DateTimeNormalizer(ZoneId.of("America/Los_Angeles"));

        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-14T21:00:00Z")),
                pacific.parseLocal("Sun, July 14, 2024", "2:00 PM"));
        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-14T14:00:00Z")),
                utc.parseLocal("Sun, July 14, 2024", "2:00 PM"));
    }

    @Test
    void testRelativeDayMarkerAndOrdinalAreIgnored() {
        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-14T18:30:00Z")),
                utc.parseLocal("Sun, July 14, 2024 Today", "6:30 pm"));
        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-14T00:00:00Z")),
                utc.parseLocal("July 14th, 2024", null));
    }

    @Test
    void testUnknownTimeIsStartOfDay() {
        assertEquals(Optional.of(OffsetDateTime.parse("2024-07-15T00:00:00Z")),
                utc.parseLocal("Mon, July 15, 2024", "TBD"));
    }

    @Test
    void testUnparseableDate() {
        assertTrue(utc.parseLocal("next week", "2:00 PM").isEmpty());
        assertTrue(utc.parseLocal(null, "2:00 PM").isEmpty());
    }

    @Test
    void testRangeBorrowsEndYear() {
        DateTimeNormalizer.DateRange range = utc.parseRange("Jun 14—Jul 14, 2024");

        assertEquals(Optional.of(OffsetDateTime.parse("2024-06-14T00:00:00Z")), range.start());
        assertEquals(Optional.of(LocalDate.of(2024, 7, 14)), range.end());
    }

    @Test
    void testRangeWithSpacedHyphen() {
        DateTimeNormalizer.DateRange range = utc.parseRange("Jun 14, 2024 - Jul 14, 2024");

        assertEquals(Optional.of(OffsetDateTime.parse("2024-06-14T00:00:00Z")), range.start());
        assertEquals(Optional.of(LocalDate.of(2024, 7, 14)), range.end());
    }

    @Test
    void testRangeWithoutAnyYearHasNoStart() {
        assertTrue(utc.parseRange("Jun 13—Jul 21").start().isEmpty());
    }
}
