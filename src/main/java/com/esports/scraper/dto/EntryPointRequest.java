package com.esports.scraper.dto;

import com.esports.scraper.model.PageTemplate;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * One listing page to start from.
 *
 * @param path     upstream path, e.g. {@code /event/matches/2095/champions-tour-2024-americas-stage-2}
 * @param template listing template; {@code MATCH_LISTING} when omitted
 * @param pages    result pages to walk; 1 when omitted
 */
public record EntryPointRequest(
        @NotBlank String path,
        PageTemplate template,
        @Min(1) @Max(50) Integer pages
) {}
