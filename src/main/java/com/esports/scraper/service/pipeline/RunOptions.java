package com.esports.scraper.service.pipeline;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.RenderMode;
import com.esports.scraper.service.fetch.FetchPolicy;
import com.esports.scraper.service.merge.ConflictPolicy;
import lombok.Builder;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Run-level settings. Defaults come from configuration; callers override
 * per run through {@link #toBuilder()}.
 *
 * @param maxConcurrency     pages in flight at once
 * @param browserConcurrency browser renders in flight at once, capped by {@code maxConcurrency}
 * @param renderModeDefault  render mode for templates without an override
 * @param renderModes        render mode per template
 * @param fetchPolicy        retry, pacing and timeout settings of every fetch
 * @param outputFormat       shape of the returned result
 * @param fetchDetails       follow detail links found on listing pages
 * @param conflictPolicy     tie-break for equal-precedence conflicts
 * @param browserSlotWait    how long a browser fetch may wait for a slot
 */
@Builder(toBuilder = true)
public record RunOptions(
        int maxConcurrency,
        int browserConcurrency,
        RenderMode renderModeDefault,
        Map<PageTemplate, RenderMode> renderModes,
        FetchPolicy fetchPolicy,
        OutputFormat outputFormat,
        boolean fetchDetails,
        ConflictPolicy conflictPolicy,
        Duration browserSlotWait
) {

    public RunOptions {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }
        if (browserConcurrency < 1) {
            throw new IllegalArgumentException("browserConcurrency must be at least 1, was " + browserConcurrency);
        }
        renderModes = renderModes == null || renderModes.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(renderModes));
    }

    public static RunOptions defaults(final ScraperProperties props) {
        ScraperProperties.Run run = props.getRun();
        Map<PageTemplate, RenderMode> modes = new EnumMap<>(PageTemplate.class);
        for (PageTemplate t : PageTemplate.values()) {
            RenderMode mode = run.getRenderModes().get(t.key());
            if (mode != null) {
                modes.put(t, mode);
            }
        }
        return RunOptions.builder()
                .maxConcurrency(run.getMaxConcurrency())
                .browserConcurrency(run.getBrowserConcurrency())
                .renderModeDefault(run.getRenderModeDefault())
                .renderModes(modes)
                .fetchPolicy(FetchPolicy.from(props.getFetch()))
                .outputFormat(run.getOutputFormat())
                .fetchDetails(run.isFetchDetails())
                .conflictPolicy(props.getMerge().getConflictPolicy())
                .browserSlotWait(run.getBrowserSlotWait())
                .build();
    }

    public RenderMode renderModeFor(final PageTemplate template) {
        return renderModes.getOrDefault(template, renderModeDefault);
    }

    /** Browser slots actually granted; never more than the overall cap. */
    public int effectiveBrowserConcurrency() {
        return Math.min(browserConcurrency, maxConcurrency);
    }
}
