package com.esports.scraper.parser;

import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.RawPage;

import java.util.List;

/**
 * Converts the markup of one page template into partial records.
 */
public interface PageParser {

    /**
     * @return the single template this parser understands
     */
    PageTemplate template();

    /**
     * @param page fetched page of {@link #template()}
     * @return one record per entry found; never {@code null}
     * @throws ParseException when the template's anchor elements are missing
     */
    List<PartialRecord> parse(RawPage page);

}
