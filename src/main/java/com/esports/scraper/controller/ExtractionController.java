package com.esports.scraper.controller;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.dto.EntryPointRequest;
import com.esports.scraper.dto.RunRequest;
import com.esports.scraper.dto.RunResponse;
import com.esports.scraper.dto.TemplateInfo;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.parser.PageParserRegistry;
import com.esports.scraper.service.fetch.FetchPolicy;
import com.esports.scraper.service.pipeline.CancellationSignal;
import com.esports.scraper.service.pipeline.EntryPoint;
import com.esports.scraper.service.pipeline.ExtractionPipeline;
import com.esports.scraper.service.pipeline.RunOptions;
import com.esports.scraper.service.pipeline.RunResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * REST controller that triggers extraction runs.
 * <p>
 * Endpoint: <code>POST /api/extraction/runs</code><br>
 * Consumes: <code>application/json</code><br>
 * Produces: <code>application/json</code>
 * </p>
 * <p>The run is synchronous: the response is returned once every target has
 * reached a final state.</p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/extraction/runs
 * Content-Type: application/json
 *
 * {
 *   "entryPoints": [
 *     { "path": "/event/matches/2095/champions-tour-2024-americas-stage-2", "template": "MATCH_LISTING" }
 *   ],
 *   "retryLimit": 3,
 *   "outputFormat": "TABLE"
 * }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "summary": { "totalFetched": 9, "totalParsed": 17, "incompleteCount": 1, "errors": [], ... },
 *   "format": "TABLE",
 *   "rows": [ { "id": "match:353177", "name": "Sentinels vs G2 Esports", ... }, ... ]
 * }
 * }</pre>
 */
@RestController
@RequestMapping("/api/extraction")
@RequiredArgsConstructor
public class ExtractionController {

    private final ExtractionPipeline pipeline;

    private final PageParserRegistry parsers;

    private final ScraperProperties props;

    /**
     * Runs one extraction with the request's overrides on top of the
     * configured defaults.
     *
     * @throws IllegalArgumentException if no entry point is given or configured
     */
    @PostMapping(path = "/runs",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public RunResponse run(@RequestBody @Validated final RunRequest request) {
        RunResult result = pipeline.run(entryPoints(request), options(request), CancellationSignal.none());
        return RunResponse.of(result);
    }

    /**
     * Lists the page templates with a registered parser.
     */
    @GetMapping(path = "/templates", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TemplateInfo> templates() {
        RunOptions defaults = RunOptions.defaults(props);
        return parsers.templates().stream()
                .sorted()
                .map(t -> new TemplateInfo(t, t.key(), t.recordType(), t.pageType(), defaults.renderModeFor(t)))
                .toList();
    }

    private List<EntryPoint> entryPoints(final RunRequest request) {
        if (request.entryPoints() == null || request.entryPoints().isEmpty()) {
            return props.getEntryPoints().stream().map(EntryPoint::from).toList();
        }
        return request.entryPoints().stream().map(ExtractionController::toEntryPoint).toList();
    }

    private static EntryPoint toEntryPoint(final EntryPointRequest e) {
        return new EntryPoint(e.path(),
                e.template() == null ? PageTemplate.MATCH_LISTING : e.template(),
                e.pages() == null ? 1 : e.pages());
    }

    private RunOptions options(final RunRequest r) {
        RunOptions defaults = RunOptions.defaults(props);
        FetchPolicy policy = defaults.fetchPolicy();
        if (r.retryLimit() != null) {
            policy = policy.withRetryLimit(r.retryLimit());
        }
        if (r.minRequestIntervalMs() != null) {
            policy = policy.withMinRequestInterval(Duration.ofMillis(r.minRequestIntervalMs()));
        }
        if (r.requestTimeoutMs() != null) {
            policy = policy.withRequestTimeout(Duration.ofMillis(r.requestTimeoutMs()));
        }

        RunOptions.RunOptionsBuilder b = defaults.toBuilder().fetchPolicy(policy);
        if (r.maxConcurrency() != null) {
            b.maxConcurrency(r.maxConcurrency());
        }
        if (r.browserConcurrency() != null) {
            b.browserConcurrency(r.browserConcurrency());
        }
        if (r.renderModeDefault() != null) {
            b.renderModeDefault(r.renderModeDefault());
        }
        if (r.outputFormat() != null) {
            b.outputFormat(r.outputFormat());
        }
        if (r.fetchDetails() != null) {
            b.fetchDetails(r.fetchDetails());
        }
        if (r.conflictPolicy() != null) {
            b.conflictPolicy(r.conflictPolicy());
        }
        return b.build();
    }
}
