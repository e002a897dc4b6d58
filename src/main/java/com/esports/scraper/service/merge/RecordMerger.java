package com.esports.scraper.service.merge;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.model.NormalizedFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point of the deduplicate/merge stage. Hands out a fresh
 * {@link MergeState} per run, configured with the run's conflict policy.
 */
@Slf4j
@Component
public class RecordMerger {

    private final ConflictPolicy defaultPolicy;

    public RecordMerger(final ScraperProperties props) {
        this.defaultPolicy = props.getMerge().getConflictPolicy();
    }

    public MergeState newState() {
        return new MergeState(defaultPolicy);
    }

    public MergeState newState(final ConflictPolicy policy) {
        log.debug("Merge state with {} tie-break", policy);
        return new MergeState(policy);
    }

    /**
     * @return id of the record the fields were merged into
     */
    public String merge(final MergeState state, final NormalizedFields fields) {
        return state.merge(fields);
    }
}
