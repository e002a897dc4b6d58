package com.esports.scraper.parser.vlr;

import com.esports.scraper.model.Fields;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.PlayerStat;
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * <h2>Match detail parser</h2>
 * <p>Reads the header block of a rendered match page (teams, event, stage,
 * UTC start, series score, status and format notes, patch), the per-map
 * result headers of the stats tabs and the player stat tables under them.</p>
 * <p>The page yields exactly one record. Its id comes from the page URL so it
 * merges with the listing card it was discovered from.</p>
 */
@Slf4j
@Component
public class MatchDetailParser implements PageParser {

    private static final String HEADER = "div.match-header";
    private static final Pattern PICK_SUFFIX = Pattern.compile("(?i)\\s*pick\\s*$");
    private static final String ALL_MAPS_TAB = "all";
    private static final String STATS_TABLE = "table.wf-table-inset.mod-overview";
    private static final String STATS_TABLE_FALLBACK = "table.vm-stats-game-table";

    /** Stat columns in page order; the two +/- columns are derived and skipped. */
    private static final String[] STAT_COLUMNS = {
            Fields.STAT_RATING, Fields.STAT_ACS, Fields.STAT_KILLS, Fields.STAT_DEATHS, Fields.STAT_ASSISTS, null,
            Fields.STAT_KAST, Fields.STAT_ADR, Fields.STAT_HS, Fields.STAT_FK, Fields.STAT_FD, null};

    @Override
    public PageTemplate template() {
        return PageTemplate.MATCH_DETAIL;
    }

    @Override
    public List<PartialRecord> parse(final RawPage page) {
        Document doc = Jsoup.parse(page.html(), page.url());
        Element header = doc.selectFirst(HEADER);
        if (header == null) {
            throw ParseException.structureMismatch(page.url(), template(), "no " + HEADER);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        List<String> teams = VlrHtml.texts(VlrHtml.firstMatching(header,
                ".match-header-link-name .wf-title-med", ".team-name"));
        fields.put(Fields.TEAM1, VlrHtml.at(teams, 0));
        fields.put(Fields.TEAM2, VlrHtml.at(teams, 1));

        fields.put(Fields.EVENT, VlrHtml.text(header,
                ".match-header-event div > div:not(.match-header-event-series)"));
        fields.put(Fields.STAGE, VlrHtml.text(header, ".match-header-event-series"));

        Element utc = header.selectFirst(".moment-tz-convert[data-utc-ts]");
        fields.put(Fields.UTC_TIMESTAMP, utc == null ? null : StringUtils.trimToNull(utc.attr("data-utc-ts")));
        List<String> dateParts = VlrHtml.texts(header.select(".match-header-date .moment-tz-convert"));
        fields.put(Fields.DATE, VlrHtml.at(dateParts, 0));
        fields.put(Fields.TIME, VlrHtml.at(dateParts, 1));

        List<String> score = VlrHtml.texts(VlrHtml.firstMatching(header,
                ".match-header-vs-score .js-spoiler span:not(.match-header-vs-score-colon)", ".score"));
        fields.put(Fields.SCORE1, VlrHtml.at(score, 0));
        fields.put(Fields.SCORE2, VlrHtml.at(score, 1));

        List<String> notes = VlrHtml.texts(header.select("div.match-header-vs-note"));
        fields.put(Fields.STATUS, VlrHtml.at(notes, 0));
        fields.put(Fields.FORMAT, VlrHtml.at(notes, 1));
        fields.put(Fields.PATCH, patch(header));

        putMaps(doc, fields);

        String id = VlrHtml.group(VlrHtml.MATCH_ID, page.url());
        log.debug("Match detail {}: id={}, {} field(s)", page.url(), id, fields.size());
        return List.of(PartialRecord.from(page, id, fields));
    }

    @Nullable
    private static String patch(final Element header) {
        Element el = header.selectFirst("div:containsOwn(Patch)");
        return el == null ? null : StringUtils.trimToNull(el.ownText());
    }

    /**
     * One entry per played map, plus the player stat tables of every tab.
     * The all-maps tab contributes stats under map {@code 0} only.
     */
    private static void putMaps(final Document doc, final Map<String, String> fields) {
        Elements games = doc.select("div.vm-stats-game");
        int order = 0;
        for (Element game : games) {
            if (ALL_MAPS_TAB.equals(game.attr("data-game-id"))) {
                putPlayerStats(game, PlayerStat.ALL_MAPS, fields);
                continue;
            }
            Element gameHeader = game.selectFirst(".vm-stats-game-header");
            Element scope = gameHeader != null ? gameHeader : game;
            String name = mapName(scope);
            if (name == null) {
                continue;
            }
            order++;
            List<String> scores = VlrHtml.texts(scope.select(".score"));
            fields.put(Fields.mapField(order, "name"), name);
            fields.put(Fields.mapField(order, "score1"), VlrHtml.at(scores, 0));
            fields.put(Fields.mapField(order, "score2"), VlrHtml.at(scores, 1));
            putPlayerStats(game, order, fields);
        }
    }

    /**
     * The first table of a tab holds team 1, the second team 2. Each stat
     * cell carries both-sides, attack and defense values; only both-sides is
     * kept.
     */
    private static void putPlayerStats(final Element game, final int mapOrder, final Map<String, String> fields) {
        Elements tables = VlrHtml.firstMatching(game, STATS_TABLE, STATS_TABLE_FALLBACK);
        for (int t = 0; t < Math.min(2, tables.size()); t++) {
            int row = 0;
            for (Element tr : tables.get(t).select("tbody tr")) {
                String player = VlrHtml.text(tr, "td.mod-player .text-of", "td.mod-player", "td");
                if (player == null) {
                    continue;
                }
                row++;
                int team = t + 1;
                fields.put(Fields.statField(mapOrder, team, row, Fields.STAT_PLAYER), player);
                fields.put(Fields.statField(mapOrder, team, row, Fields.STAT_AGENT), agent(tr));
                Elements cells = tr.select("td.mod-stat");
                for (int c = 0; c < Math.min(cells.size(), STAT_COLUMNS.length); c++) {
                    if (STAT_COLUMNS[c] != null) {
                        fields.put(Fields.statField(mapOrder, team, row, STAT_COLUMNS[c]), bothSides(cells.get(c)));
                    }
                }
            }
        }
    }

    @Nullable
    private static String agent(final Element row) {
        Element img = row.selectFirst("td.mod-agents img, .mod-agent img, img[src*=/agents/]");
        if (img == null) {
            return null;
        }
        String title = StringUtils.trimToNull(img.attr("title"));
        return title != null ? title : StringUtils.capitalize(StringUtils.trimToNull(img.attr("alt")));
    }

    @Nullable
    private static String bothSides(final Element cell) {
        Element both = cell.selectFirst(".mod-both");
        if (both != null) {
            return StringUtils.trimToNull(both.text());
        }
        if (cell.selectFirst(".mod-t, .mod-ct") != null) {
            return null;
        }
        return StringUtils.trimToNull(cell.text());
    }

    @Nullable
    private static String mapName(final Element scope) {
        Element map = scope.selectFirst(".map");
        if (map == null) {
            return null;
        }
        Element span = map.selectFirst("span");
        String raw = span != null && StringUtils.isNotBlank(span.ownText()) ? span.ownText() : map.text();
        return StringUtils.trimToNull(PICK_SUFFIX.matcher(raw).replaceAll(""));
    }
}
