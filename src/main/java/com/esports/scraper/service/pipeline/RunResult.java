package com.esports.scraper.service.pipeline;

import com.esports.scraper.model.CanonicalRecord;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Output of one extraction run.
 *
 * @param records canonical records, sorted by id
 * @param summary run report
 * @param format  requested output shape
 * @param rows    flat table rows for {@link OutputFormat#TABLE}, empty otherwise
 */
public record RunResult(
        List<CanonicalRecord> records,
        RunSummary summary,
        OutputFormat format,
        List<Map<String, Object>> rows
) {

    public Stream<CanonicalRecord> stream() {
        return records.stream();
    }
}
