package com.esports.scraper.parser.vlr;

import com.esports.scraper.model.Fields;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.parser.ParseErrorKind;
import com.esports.scraper.parser.ParseException;
import com.esports.scraper.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MatchListingParserTest {

    private static final String PATH = "/event/matches/2095/champions-tour-2024-americas-stage-2";

    private final MatchListingParser parser = new MatchListingParser();

    @Test
    void testOneRecordPerCard() {
        List<PartialRecord> records = parser.parse(
                Fixtures.page("match-listing.html", PATH, PageTemplate.MATCH_LISTING));

        assertEquals(2, records.size());
        PartialRecord first = records.get(0);
        assertEquals("353177", first.recordId());
        assertEquals("Sentinels", first.field(Fields.TEAM1));
        assertEquals("G2 Esports", first.field(Fields.TEAM2));
        assertEquals("2", first.field(Fields.SCORE1));
        assertEquals("1", first.field(Fields.SCORE2));
        assertEquals("Sun, July 14, 2024", first.field(Fields.DATE));
        assertEquals("2:00 PM", first.field(Fields.TIME));
        assertEquals("Completed", first.field(Fields.STATUS));
        assertEquals("Champions Tour 2024: Americas Stage 2", first.field(Fields.EVENT));
        assertEquals("Playoffs–Upper Final", first.field(Fields.STAGE));
        assertEquals(Fixtures.BASE + "/353177/sentinels-vs-g2-esports-champions-tour-2024-americas-stage-2-ubf",
                first.field(Fields.DETAIL_URL));
        assertEquals(Fixtures.BASE + PATH, first.sourceUrl());
        assertEquals(0, first.position());
        assertEquals(1, records.get(1).position());
    }

    @Test
    void testCardWithoutDayHeaderHasNoDate() {
        PartialRecord second = parser.parse(
                Fixtures.page("match-listing.html", PATH, PageTemplate.MATCH_LISTING)).get(1);

        assertEquals("353178", second.recordId());
        assertNull(second.field(Fields.DATE));
        assertEquals("TBD", second.field(Fields.TIME));
        assertEquals("KRÜ Esports", second.field(Fields.TEAM2));
        assertEquals("1d 4h", second.field(Fields.ETA));
    }

    @Test
    void testLegacyLayoutFallback() {
        List<PartialRecord> records = parser.parse(
                Fixtures.page("match-listing-legacy.html", "/matches", PageTemplate.MATCH_LISTING));

        assertEquals(1, records.size());
        PartialRecord r = records.get(0);
        assertEquals("360001", r.recordId());
        assertEquals("Team A", r.field(Fields.TEAM1));
        assertEquals("Team B", r.field(Fields.TEAM2));
        assertEquals("13", r.field(Fields.SCORE1));
        assertEquals("9", r.field(Fields.SCORE2));
        assertEquals("Mon, July 15, 2024", r.field(Fields.DATE));
        assertEquals("Final", r.field(Fields.STATUS));
    }

    @Test
    void testRedesignedLayoutIsStructureMismatch() {
        ParseException ex = assertThrows(ParseException.class, () -> parser.parse(
                Fixtures.page("match-listing-redesigned.html", PATH, PageTemplate.MATCH_LISTING)));

        assertEquals(ParseErrorKind.STRUCTURE_MISMATCH, ex.getKind());
        assertEquals(Fixtures.BASE + PATH, ex.getUrl());
    }
}
