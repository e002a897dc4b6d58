package com.esports.scraper.service.pipeline;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PageType;
import org.apache.commons.lang3.StringUtils;

/**
 * A listing page a run starts from.
 *
 * @param path     upstream path or absolute URL
 * @param template listing template of the page
 * @param pages    number of result pages to walk, 1 for the page alone
 */
public record EntryPoint(String path, PageTemplate template, int pages) {

    public EntryPoint {
        if (StringUtils.isBlank(path)) {
            throw new IllegalArgumentException("entry point path must not be blank");
        }
        if (template.pageType() != PageType.LISTING) {
            throw new IllegalArgumentException("entry point template must be a listing, was " + template);
        }
        if (pages < 1) {
            throw new IllegalArgumentException("pages must be at least 1, was " + pages);
        }
    }

    public static EntryPoint of(final String path, final PageTemplate template) {
        return new EntryPoint(path, template, 1);
    }

    public static EntryPoint from(final ScraperProperties.EntryPointCfg cfg) {
        return new EntryPoint(cfg.getPath(), cfg.getTemplate(), cfg.getPages());
    }
}
