package com.esports.scraper.parser;

import com.esports.scraper.model.PageTemplate;
import lombok.Getter;

/**
 * Page markup no longer matches what its template's parser expects.
 */
@Getter
public class ParseException extends RuntimeException {

    private final ParseErrorKind kind;

    private final String url;

    private final PageTemplate template;

    public ParseException(final ParseErrorKind kind, final String url,
                          final PageTemplate template, final String message) {
        super(kind + " on " + template.key() + " page " + url + ": " + message);
        this.kind = kind;
        this.url = url;
        this.template = template;
    }

    public static ParseException structureMismatch(final String url, final PageTemplate template,
                                                   final String message) {
        return new ParseException(ParseErrorKind.STRUCTURE_MISMATCH, url, template, message);
    }
}
