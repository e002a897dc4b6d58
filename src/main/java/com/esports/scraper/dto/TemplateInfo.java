package com.esports.scraper.dto;

import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PageType;
import com.esports.scraper.model.RecordType;
import com.esports.scraper.model.RenderMode;

/**
 * A supported page template and the render mode runs use for it by default.
 */
public record TemplateInfo(
        PageTemplate template,
        String key,
        RecordType recordType,
        PageType pageType,
        RenderMode defaultRenderMode
) {}
