package com.esports.scraper.dto;

import com.esports.scraper.model.RenderMode;
import com.esports.scraper.service.merge.ConflictPolicy;
import com.esports.scraper.service.pipeline.OutputFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Request payload for an extraction run. Every option is optional and falls
 * back to the configured default.
 *
 * @param entryPoints          listing pages to start from; configured entry points when empty
 * @param maxConcurrency       pages in flight at once
 * @param browserConcurrency   browser renders in flight at once
 * @param renderModeDefault    render mode for templates without an override
 * @param retryLimit           total attempts per page
 * @param minRequestIntervalMs minimum spacing between request starts to the host
 * @param requestTimeoutMs     per-attempt timeout
 * @param outputFormat         {@code TABLE} or {@code SEQUENCE}
 * @param fetchDetails         follow detail links
 * @param conflictPolicy       tie-break between equal-precedence sources
 */
public record RunRequest(
        @Valid List<EntryPointRequest> entryPoints,
        @Min(1) @Max(32) Integer maxConcurrency,
        @Min(1) @Max(8) Integer browserConcurrency,
        RenderMode renderModeDefault,
        @Min(1) @Max(10) Integer retryLimit,
        @Min(0) Long minRequestIntervalMs,
        @Min(100) Long requestTimeoutMs,
        OutputFormat outputFormat,
        Boolean fetchDetails,
        ConflictPolicy conflictPolicy
) {}
