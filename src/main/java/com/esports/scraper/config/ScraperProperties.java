package com.esports.scraper.config;

import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.RenderMode;
import com.esports.scraper.service.merge.ConflictPolicy;
import com.esports.scraper.service.pipeline.OutputFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the pipeline configuration from <code>application.yml</code> under
 * the <code>scraper</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * scraper:
 *   upstream:
 *     base-url: https://www.vlr.gg
 *   fetch:
 *     retry-limit: 3
 *     min-request-interval: 1500ms
 *   run:
 *     max-concurrency: 4
 *     render-modes:
 *       match-detail: browser
 *   entry-points:
 *     - path: /event/matches/2095/champions-tour-2024-americas-stage-2
 *       template: match-listing
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "scraper")
@Getter
@Setter
public class ScraperProperties {

    @Valid
    private Upstream upstream = new Upstream();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Browser browser = new Browser();

    @Valid
    private Run run = new Run();

    private Merge merge = new Merge();

    /**
     * Listing pages a run starts from when the caller supplies none.
     */
    @Valid
    private List<EntryPointCfg> entryPoints = new ArrayList<>();

    @Data
    public static class Upstream {

        /** Scheme and host every fetched URL must share, e.g. https://www.vlr.gg */
        @NotBlank
        private String baseUrl = "https://www.vlr.gg";

        /** Zone the listing pages print their local dates and times in. */
        private ZoneId zone = ZoneId.of("UTC");

        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
                + "AppleWebKit/537.36 (KHTML, like Gecko) "
                + "Chrome/125.0.0.0 Safari/537.36";
    }

    @Data
    public static class Fetch {

        /** Total attempts per page, first try included. */
        @Min(1)
        private int retryLimit = 3;

        @NotNull
        private Duration minRequestInterval = Duration.ofMillis(1500);

        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(20);

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        private double backoffMultiplier = 2.0;

        /** Randomization factor applied to each backoff interval. */
        private double jitter = 0.5;
    }

    @Data
    public static class Browser {

        private boolean headless = true;

        /** Optional chromedriver binary; Selenium Manager resolves one when blank. */
        private String driverPath;

        /** Fixed wait after navigation when a template has no ready selector. */
        private Duration settleTime = Duration.ofSeconds(2);

        /** CSS selector whose presence marks a rendered page as ready, per template key. */
        private Map<String, String> readySelectors = new LinkedHashMap<>(Map.of(
                PageTemplate.MATCH_DETAIL.key(), "div.match-header",
                PageTemplate.EVENT_DETAIL.key(), "h1.wf-title"));
    }

    @Data
    public static class Run {

        @Min(1)
        private int maxConcurrency = 4;

        @Min(1)
        private int browserConcurrency = 1;

        private RenderMode renderModeDefault = RenderMode.HTTP;

        /** Render mode per template key, overriding {@link #renderModeDefault}. */
        private Map<String, RenderMode> renderModes = new LinkedHashMap<>(Map.of(
                PageTemplate.MATCH_DETAIL.key(), RenderMode.BROWSER));

        private OutputFormat outputFormat = OutputFormat.TABLE;

        /** Follow detail links discovered on listing pages. */
        private boolean fetchDetails = true;

        /** Upper bound on how long a run waits for a browser slot. */
        private Duration browserSlotWait = Duration.ofMinutes(5);
    }

    @Data
    public static class Merge {

        /** Tie-break between equal-precedence sources that disagree. */
        private ConflictPolicy conflictPolicy = ConflictPolicy.FIRST_SEEN;
    }

    @Data
    public static class EntryPointCfg {

        @NotBlank
        private String path;

        @NotNull
        private PageTemplate template = PageTemplate.MATCH_LISTING;

        /** Number of result pages to walk via the {@code page} query parameter. */
        @Min(1)
        private int pages = 1;
    }
}
