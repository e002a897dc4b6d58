package com.esports.scraper.parser;

import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches a page to the parser registered for its template.
 * <p>
 * Built from every {@link PageParser} bean. Two parsers for one template are
 * a wiring error and fail the context start-up.
 * </p>
 */
@Slf4j
@Component
public class PageParserRegistry {

    private final Map<PageTemplate, PageParser> parsers = new EnumMap<>(PageTemplate.class);

    public PageParserRegistry(final List<PageParser> candidates) {
        for (PageParser parser : candidates) {
            PageParser previous = parsers.putIfAbsent(parser.template(), parser);
            if (previous != null) {
                throw new IllegalStateException("Two parsers for " + parser.template() + ": "
                        + previous.getClass().getSimpleName() + ", " + parser.getClass().getSimpleName());
            }
        }
        log.info("Page parsers registered for {}", parsers.keySet());
    }

    /**
     * @throws IllegalArgumentException if no parser handles the page's template
     * @throws ParseException           if the page does not match its template
     */
    public List<PartialRecord> parse(final RawPage page) {
        PageParser parser = parsers.get(page.template());
        if (parser == null) {
            throw new IllegalArgumentException("No parser for template " + page.template());
        }
        List<PartialRecord> records = parser.parse(page);
        log.debug("{} -> {} partial record(s) from {}", page.template().key(), records.size(), page.url());
        return records;
    }

    public Set<PageTemplate> templates() {
        return Collections.unmodifiableSet(parsers.keySet());
    }
}
