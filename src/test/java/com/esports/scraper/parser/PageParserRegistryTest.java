package com.esports.scraper.parser;

import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.parser.vlr.MatchDetailParser;
import com.esports.scraper.parser.vlr.MatchListingParser;
import com.esports.scraper.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PageParserRegistryTest {

    @Test
    void testDispatchesByTemplate() {
        PageParserRegistry registry = new PageParserRegistry(List.of(new MatchListingParser(), new MatchDetailParser()));

        List<PartialRecord> records = registry.parse(Fixtures.page("match-detail.html",
                "/353177/sentinels-vs-g2-esports", PageTemplate.MATCH_DETAIL));

        assertEquals(1, records.size());
        assertEquals(EnumSet.of(PageTemplate.MATCH_LISTING, PageTemplate.MATCH_DETAIL), registry.templates());
    }

    @Test
    void testUnregisteredTemplate() {
        PageParserRegistry registry = new PageParserRegistry(List.of(new MatchListingParser()));

        assertThrows(IllegalArgumentException.class, () -> registry.parse(
                Fixtures.page("event-listing.html", "/events", PageTemplate.EVENT_LISTING)));
    }

    @Test
    void testTwoParsersForOneTemplateFailWiring() {
        assertThrows(IllegalStateException.class,
                () -> new PageParserRegistry(List.of(new MatchListingParser(), new MatchListingParser())));
    }
}
