package com.esports.scraper.service.normalize;

import com.esports.scraper.model.Fields;
import com.esports.scraper.model.MapScore;
import com.esports.scraper.model.MatchStatus;
import com.esports.scraper.model.NormalizedFields;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PageType;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.PlayerStat;
import com.esports.scraper.model.RecordType;
import com.esports.scraper.model.Score;
import com.esports.scraper.parser.vlr.EventListingParser;
import com.esports.scraper.parser.vlr.MatchDetailParser;
import com.esports.scraper.parser.vlr.MatchListingParser;
import com.esports.scraper.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordNormalizerTest {

    private static final String LISTING = "/event/matches/2095/champions-tour-2024-americas-stage-2";

    private final RecordNormalizer normalizer = new RecordNormalizer(ZoneOffset.UTC);

    @Test
    void testCompletedListingCard() {
        PartialRecord card = new MatchListingParser().parse(
                Fixtures.page("match-listing.html", LISTING, PageTemplate.MATCH_LISTING)).get(0);

        NormalizedFields f = normalizer.normalize(card);

        assertEquals("353177", f.nativeId());
        assertEquals(RecordType.MATCH, f.type());
        assertEquals(PageType.LISTING, f.pageType());
        assertEquals("Sentinels vs G2 Esports", f.name());
        assertEquals(List.of("Sentinels", "G2 Esports"), f.participants());
        assertEquals(OffsetDateTime.parse("2024-07-14T14:00:00Z"), f.scheduledTime().value());
        assertEquals(new Score(2, 1), f.score());
        assertEquals(MatchStatus.COMPLETED, f.status());
        assertEquals("Champions Tour 2024: Americas Stage 2", f.attributes().get(Fields.EVENT));
        assertFalse(f.attributes().containsKey(Fields.TEAM1));
        assertTrue(f.warnings().isEmpty());
        assertFalse(f.isIncomplete());
    }

    @Test
    void testUpcomingCardWithoutDateIsIncomplete() {
        PartialRecord card = new MatchListingParser().parse(
                Fixtures.page("match-listing.html", LISTING, PageTemplate.MATCH_LISTING)).get(1);

        NormalizedFields f = normalizer.normalize(card);

        assertEquals(List.of("LEVIATÁN", "KRÜ Esports"), f.participants());
        assertFalse(f.scheduledTime().isKnown());
        assertEquals("TBD", f.scheduledTime().raw());
        assertEquals("unknown", f.scheduledTime().toString());
        assertNull(f.score());
        assertEquals(MatchStatus.UPCOMING, f.status());
        assertEquals(Set.of(RecordNormalizer.REQUIRED_TIME), f.missingRequired());
        assertEquals(1, f.warnings().size());
        assertEquals("no date on page", f.warnings().get(0).message());
    }

    @Test
    void testDetailPagePrefersUtcTimestamp() {
        PartialRecord detail = new MatchDetailParser().parse(Fixtures.page("match-detail.html",
                "/353177/sentinels-vs-g2-esports", PageTemplate.MATCH_DETAIL)).get(0);

        NormalizedFields f = normalizer.normalize(detail);

        assertEquals(PageType.DETAIL, f.pageType());
        assertEquals(OffsetDateTime.parse("2024-07-14T21:00:00Z"), f.scheduledTime().value());
        assertEquals(MatchStatus.COMPLETED, f.status());
        assertEquals(List.of(new MapScore(1, "Lotus", 13, 8), new MapScore(2, "Split", 10, 13),
                new MapScore(3, "Haven", 13, 11)), f.maps());
        assertEquals("Bo3", f.attributes().get(Fields.FORMAT));
        assertEquals("Patch 9.01", f.attributes().get(Fields.PATCH));
    }

    @Test
    void testDetailPlayerStatLines() {
        PartialRecord detail = new MatchDetailParser().parse(Fixtures.page("match-detail.html",
                "/353177/sentinels-vs-g2-esports", PageTemplate.MATCH_DETAIL)).get(0);

        NormalizedFields f = normalizer.normalize(detail);

        List<PlayerStat> stats = f.playerStats();
        assertEquals(5, stats.size());
        PlayerStat overview = stats.get(0);
        assertEquals(PlayerStat.ALL_MAPS, overview.mapOrder());
        assertNull(overview.map());
        assertEquals(52, overview.kills());

        PlayerStat tenz = stats.get(1);
        assertEquals(1, tenz.mapOrder());
        assertEquals("Lotus", tenz.map());
        assertEquals(1, tenz.team());
        assertEquals("TenZ", tenz.player());
        assertEquals("Jett", tenz.agent());
        assertEquals(1.31, tenz.rating());
        assertEquals(268, tenz.acs());
        assertEquals(21, tenz.kills());
        assertEquals(14, tenz.deaths());
        assertEquals(4, tenz.assists());
        assertEquals(76, tenz.kast());
        assertEquals(172, tenz.adr());
        assertEquals(31, tenz.headshotPercent());
        assertEquals(5, tenz.firstKills());
        assertEquals(2, tenz.firstDeaths());

        PlayerStat trent = stats.get(4);
        assertEquals(2, trent.team());
        assertEquals("trent", trent.player());
        assertNull(trent.firstKills());
        assertTrue(f.warnings().isEmpty());
        assertFalse(f.attributes().keySet().stream().anyMatch(k -> k.startsWith(Fields.STATS_PREFIX)));
    }

    @Test
    void testUnreadableStatCellBecomesWarning() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(Fields.TEAM1, "Sentinels");
        fields.put(Fields.TEAM2, "G2 Esports");
        fields.put(Fields.statField(1, 1, 1, Fields.STAT_PLAYER), "TenZ");
        fields.put(Fields.statField(1, 1, 1, Fields.STAT_ACS), "lots");
        fields.put(Fields.statField(1, 1, 1, Fields.STAT_RATING), "1.1.1");

        NormalizedFields f = normalizer.normalize(partial(fields));

        PlayerStat line = f.playerStats().get(0);
        assertNull(line.acs());
        assertNull(line.rating());
        assertNull(line.map());
        assertEquals(2, f.warnings().stream().filter(w -> w.field().startsWith(Fields.STATS_PREFIX)).count());
    }

    @Test
    void testEventRange() {
        List<PartialRecord> cards = new EventListingParser().parse(
                Fixtures.page("event-listing.html", "/events", PageTemplate.EVENT_LISTING));

        NormalizedFields first = normalizer.normalize(cards.get(0));
        assertEquals(RecordType.EVENT, first.type());
        assertEquals(OffsetDateTime.parse("2024-06-14T00:00:00Z"), first.scheduledTime().value());
        assertEquals("2024-07-14", first.attributes().get("endDate"));
        assertEquals("$250,000", first.attributes().get(Fields.PRIZE_POOL));
        assertTrue(first.participants().isEmpty());
        assertFalse(first.isIncomplete());

        NormalizedFields second = normalizer.normalize(cards.get(1));
        assertFalse(second.scheduledTime().isKnown());
        assertEquals(Set.of(RecordNormalizer.REQUIRED_TIME), second.missingRequired());
        assertEquals("unrecognised date range", second.warnings().get(0).message());
    }

    @Test
    void testBadScoresBecomeWarnings() {
        NormalizedFields f = normalizer.normalize(partial(Map.of(
                Fields.TEAM1, "A", Fields.TEAM2, "B",
                Fields.SCORE1, "-3", Fields.SCORE2, "two",
                Fields.DATE, "Jul 14, 2024")));

        assertNull(f.score());
        assertEquals(2, f.warnings().size());
        assertEquals(MatchStatus.UNKNOWN, f.status());
    }

    @Test
    void testUnrecognisedStatusAndMissingTeams() {
        Map<String, String> fields = new HashMap<>();
        fields.put(Fields.TEAM1, "A");
        fields.put(Fields.STATUS, "postponed");
        fields.put(Fields.DATE, "Sat, July 13, 2024");

        NormalizedFields f = normalizer.normalize(partial(fields));

        assertEquals(MatchStatus.UNKNOWN, f.status());
        assertNull(f.name());
        assertEquals(Set.of(RecordNormalizer.REQUIRED_NAME, RecordNormalizer.REQUIRED_PARTICIPANTS),
                f.missingRequired());
        assertEquals("unrecognised status", f.warnings().get(0).message());
    }

    @Test
    void testNamesAreComposedAndCollapsed() {
        assertEquals("LEVIATÁN", Names.display("LEVIATA\u0301N"));
        assertEquals("KRÜ Esports", Names.display("  KRÜ   Esports "));
        assertEquals("krü esports", Names.key("KRÜ Esports"));
        assertNull(Names.display("   "));
    }

    private static PartialRecord partial(final Map<String, String> fields) {
        return new PartialRecord("1", PageTemplate.MATCH_LISTING, fields,
                Fixtures.BASE + "/matches", 0, 0, Instant.parse("2024-07-15T08:00:00Z"));
    }
}
