package com.esports.scraper.service.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Run report handed back with the records.
 *
 * @param totalFetched    pages retrieved successfully
 * @param totalParsed     partial records produced by the parsers
 * @param incompleteCount emitted records flagged incomplete
 * @param errors          page-level failures, ordered by URL
 * @param targetStates    final state of every target, by URL
 * @param cancelled       the run was stopped before all targets were issued
 */
public record RunSummary(
        int totalFetched,
        int totalParsed,
        int incompleteCount,
        List<RunError> errors,
        Map<String, TargetState> targetStates,
        boolean cancelled
) {
}
