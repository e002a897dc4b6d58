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
 * <h2>Match listing parser</h2>
 * <p>Reads the match cards of an event's <code>/event/matches/…</code> page
 * and of the global <code>/matches</code> and <code>/matches/results</code>
 * pages. Cards are grouped under day headers:</p>
 * <pre>{@code
 * <div class="wf-label mod-large">Sun, July 14, 2024</div>
 * <div class="wf-card">
 *   <a class="wf-module-item match-item" href="/353177/sentinels-vs-g2-…">
 *     <div class="match-item-time">2:00 PM</div>
 *     <div class="match-item-vs-team-name"><div class="text-of">Sentinels</div></div>
 *     <div class="match-item-vs-team-score">2</div>
 *     …
 *     <div class="ml-status">Completed</div>
 *     <div class="match-item-event">
 *       <div class="match-item-event-series">Playoffs: Upper Final</div>
 *       Champions Tour 2024: Americas Stage 2
 *     </div>
 *   </a>
 * </div>
 * }</pre>
 * <p>The older <code>vm-date</code> / <code>a.vm-match</code> layout is read
 * as a fallback. A page with neither kind of card is a structure mismatch.</p>
 */
@Slf4j
@Component
public class MatchListingParser implements PageParser {

    private static final String CARD = "a.wf-module-item.match-item";
    private static final String CARD_FALLBACK = "a.vm-match";
    private static final String DAY_HEADER = "div.wf-label.mod-large";

    @Override
    public PageTemplate template() {
        return PageTemplate.MATCH_LISTING;
    }

    @Override
    public List<PartialRecord> parse(final RawPage page) {
        Document doc = Jsoup.parse(page.html(), page.url());
        Elements cards = VlrHtml.firstMatching(doc, CARD, CARD_FALLBACK);
        if (cards.isEmpty()) {
            throw ParseException.structureMismatch(page.url(), template(),
                    "no match cards (" + CARD + ", " + CARD_FALLBACK + ")");
        }

        List<PartialRecord> out = new ArrayList<>(cards.size());
        for (Element card : cards) {
            String href = card.attr("href");
            Map<String, String> fields = new LinkedHashMap<>();

            List<String> teams = VlrHtml.texts(VlrHtml.firstMatching(card,
                    ".match-item-vs-team-name .text-of", ".match-item-vs-team-name", ".vm-t-name"));
            fields.put(Fields.TEAM1, VlrHtml.at(teams, 0));
            fields.put(Fields.TEAM2, VlrHtml.at(teams, 1));

            List<String> scores = teamScores(card);
            fields.put(Fields.SCORE1, VlrHtml.at(scores, 0));
            fields.put(Fields.SCORE2, VlrHtml.at(scores, 1));

            fields.put(Fields.DATE, dayHeader(card));
            fields.put(Fields.TIME, VlrHtml.text(card, ".match-item-time", ".vm-time"));
            fields.put(Fields.STATUS, VlrHtml.text(card, ".ml-status", ".vm-status"));
            fields.put(Fields.ETA, VlrHtml.text(card, ".ml-eta"));
            fields.put(Fields.STAGE, VlrHtml.text(card, ".match-item-event-series"));
            fields.put(Fields.EVENT, eventName(card));
            fields.put(Fields.DETAIL_URL, StringUtils.trimToNull(card.absUrl("href")));

            out.add(PartialRecord.from(page, out.size(), VlrHtml.group(VlrHtml.MATCH_ID, href), fields));
        }
        log.debug("Match listing {}: {} card(s)", page.url(), out.size());
        return out;
    }

    /**
     * Per-team score cells, or the combined <code>2 : 1</code> cell of the
     * older layout split in two.
     */
    private static List<String> teamScores(final Element card) {
        List<String> scores = VlrHtml.texts(
                VlrHtml.firstMatching(card, ".match-item-vs-team-score", ".vm-t-score"));
        if (!scores.isEmpty()) {
            return scores;
        }
        String combined = VlrHtml.text(card, ".vm-score");
        if (combined == null) {
            return List.of();
        }
        String[] parts = combined.split("[:\\u2013-]");
        List<String> split = new ArrayList<>(parts.length);
        for (String part : parts) {
            split.add(StringUtils.trimToNull(part));
        }
        return split;
    }

    /**
     * Nearest day header before the card: a preceding sibling of the card or
     * of one of its ancestors. The older layout puts the label inside the
     * enclosing <code>div.vm-date</code>.
     */
    @Nullable
    static String dayHeader(final Element card) {
        for (Element el = card; el != null && !"body".equals(el.tagName()); el = el.parent()) {
            for (Element sib = el.previousElementSibling(); sib != null; sib = sib.previousElementSibling()) {
                if (sib.is(DAY_HEADER)) {
                    return StringUtils.defaultIfBlank(StringUtils.trimToNull(sib.ownText()),
                            StringUtils.trimToNull(sib.text()));
                }
            }
        }
        Element day = card.closest("div.vm-date");
        return day == null ? null : VlrHtml.text(day, "div.vm-date-label");
    }

    /**
     * The event name is the bare text next to the series div.
     */
    @Nullable
    private static String eventName(final Element card) {
        String own = VlrHtml.ownText(card, ".match-item-event");
        return own != null ? own : VlrHtml.text(card, ".match-item-event");
    }
}
