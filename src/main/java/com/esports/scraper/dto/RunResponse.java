package com.esports.scraper.dto;

import com.esports.scraper.model.CanonicalRecord;
import com.esports.scraper.service.pipeline.OutputFormat;
import com.esports.scraper.service.pipeline.RunResult;
import com.esports.scraper.service.pipeline.RunSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Response of an extraction run: the report plus either table rows or
 * canonical records, depending on the requested format.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        RunSummary summary,
        OutputFormat format,
        List<Map<String, Object>> rows,
        List<CanonicalRecord> records
) {

    public static RunResponse of(final RunResult result) {
        return result.format() == OutputFormat.TABLE
                ? new RunResponse(result.summary(), result.format(), result.rows(), null)
                : new RunResponse(result.summary(), result.format(), null, result.records());
    }
}
