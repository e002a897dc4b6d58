package com.esports.scraper.parser.vlr;

import com.esports.scraper.model.Fields;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.RawPage;
import com.esports.scraper.parser.PageParser;
import com.esports.scraper.parser.ParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the event cards of the <code>/events</code> listing.
 */
@Slf4j
@Component
public class EventListingParser implements PageParser {

    private static final String CARD = "a.wf-card.event-item";
    private static final String CARD_FALLBACK = "a.event-item";

    @Override
    public PageTemplate template() {
        return PageTemplate.EVENT_LISTING;
    }

    @Override
    public List<PartialRecord> parse(final RawPage page) {
        Document doc = Jsoup.parse(page.html(), page.url());
        Elements cards = VlrHtml.firstMatching(doc, CARD, CARD_FALLBACK);
        if (cards.isEmpty()) {
            throw ParseException.structureMismatch(page.url(), template(), "no event cards (" + CARD_FALLBACK + ")");
        }

        List<PartialRecord> out = new ArrayList<>(cards.size());
        for (Element card : cards) {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(Fields.NAME, VlrHtml.text(card, ".event-item-title"));
            fields.put(Fields.STATUS, VlrHtml.text(card, ".event-item-desc-item-status"));
            fields.put(Fields.PRIZE_POOL, descValue(card, ".event-item-desc-item.mod-prize"));
            fields.put(Fields.DATES, descValue(card, ".event-item-desc-item.mod-dates"));
            fields.put(Fields.REGION, region(card));
            fields.put(Fields.DETAIL_URL, StringUtils.trimToNull(card.absUrl("href")));
            out.add(PartialRecord.from(page, out.size(), VlrHtml.group(VlrHtml.EVENT_ID, card.attr("href")), fields));
        }
        log.debug("Event listing {}: {} card(s)", page.url(), out.size());
        return out;
    }

    /** Value text of a description item, without its caption child. */
    @Nullable
    private static String descValue(final Element card, final String selector) {
        return VlrHtml.ownText(card, selector);
    }

    /** Region code from the flag icon, e.g. {@code flag mod-us} gives {@code us}. */
    @Nullable
    private static String region(final Element card) {
        Element flag = card.selectFirst(".event-item-desc-item.mod-location .flag");
        if (flag == null) {
            return null;
        }
        return flag.classNames().stream()
                .filter(c -> c.startsWith("mod-"))
                .map(c -> c.substring("mod-".length()))
                .findFirst()
                .orElse(null);
    }
}
