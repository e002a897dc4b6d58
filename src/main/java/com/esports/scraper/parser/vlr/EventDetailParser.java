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
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads an event overview page: title, subtitle and the label/value
 * description items (dates, location, prize pool).
 */
@Slf4j
@Component
public class EventDetailParser implements PageParser {

    @Override
    public PageTemplate template() {
        return PageTemplate.EVENT_DETAIL;
    }

    @Override
    public List<PartialRecord> parse(final RawPage page) {
        Document doc = Jsoup.parse(page.html(), page.url());
        Element header = doc.selectFirst("div.event-header");
        Element title = doc.selectFirst("h1.wf-title");
        if (header == null && title == null) {
            throw ParseException.structureMismatch(page.url(), template(), "no event header or h1.wf-title");
        }

        Element scope = header != null ? header : doc;
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(Fields.NAME, VlrHtml.text(scope, "h1.wf-title"));
        fields.put(Fields.SUBTITLE, VlrHtml.text(scope, "h2.event-desc-subtitle"));

        for (Element item : scope.select("div.event-desc-item")) {
            String label = VlrHtml.text(item, "div.event-desc-item-label");
            String value = VlrHtml.text(item, "div.event-desc-item-value");
            if (label == null || value == null) {
                continue;
            }
            String key = fieldFor(label);
            if (key != null) {
                fields.put(key, value);
            }
        }

        String id = VlrHtml.group(VlrHtml.EVENT_ID, page.url());
        log.debug("Event detail {}: id={}, {} field(s)", page.url(), id, fields.size());
        return List.of(PartialRecord.from(page, id, fields));
    }

    private static String fieldFor(final String label) {
        String l = StringUtils.lowerCase(label, Locale.ROOT);
        if (l.contains("date")) {
            return Fields.DATES;
        }
        if (l.contains("location")) {
            return Fields.LOCATION;
        }
        if (l.contains("prize")) {
            return Fields.PRIZE_POOL;
        }
        return null;
    }
}
