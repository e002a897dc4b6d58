package com.esports.scraper.service.pipeline;

import lombok.Getter;

/**
 * Not a single page of the run could be fetched. Carries the run report so
 * the caller sees why.
 */
@Getter
public class NoDataExtractedException extends RuntimeException {

    private final RunSummary summary;

    public NoDataExtractedException(final RunSummary summary) {
        super("No page could be fetched (" + summary.errors().size() + " error(s), "
                + summary.targetStates().size() + " target(s))");
        this.summary = summary;
    }
}
