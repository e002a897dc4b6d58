package com.esports.scraper.service.pipeline;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.model.CanonicalRecord;
import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.Fields;
import com.esports.scraper.model.NormalizedFields;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.PageType;
import com.esports.scraper.model.PartialRecord;
import com.esports.scraper.model.RawPage;
import com.esports.scraper.parser.PageParserRegistry;
import com.esports.scraper.parser.ParseException;
import com.esports.scraper.service.fetch.FetchException;
import com.esports.scraper.service.fetch.PageFetcher;
import com.esports.scraper.service.fetch.PageFetcherFactory;
import com.esports.scraper.service.merge.MergeState;
import com.esports.scraper.service.merge.RecordMerger;
import com.esports.scraper.service.normalize.RecordNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * <h2>Extraction pipeline</h2>
 *
 * <p>Runs one extraction: fetch, parse, normalize and merge every target,
 * then hand back the merged records with a run report.</p>
 *
 * <h3>Phases</h3>
 * <ol>
 *   <li><strong>Listing</strong>: every entry point, expanded over its
 *       result pages with the <code>page</code> query parameter.</li>
 *   <li><strong>Detail</strong>: the detail links found on the listing
 *       pages, deduplicated, in listing order. Skipped when detail fetching
 *       is off.</li>
 * </ol>
 * <p>Ordinals are assigned when targets are built, never when they finish,
 * so the merge tie-breaks and therefore the output do not depend on the
 * order in which pages complete.</p>
 *
 * <h3>Failures</h3>
 * <p>A page that cannot be fetched or parsed becomes an entry in the run
 * report. A detail page that fails or is skipped marks its listing record
 * incomplete. Only a run whose every issued fetch failed fails as a whole,
 * with {@link NoDataExtractedException}. A run cancelled before its first
 * fetch returns an empty, cancelled result instead.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionPipeline {

    private static final String PAGE_PARAM = "page";

    private final PageFetcherFactory fetcherFactory;

    private final PageParserRegistry parsers;

    private final RecordNormalizer normalizer;

    private final RecordMerger merger;

    private final RecordTableFormatter tableFormatter;

    private final ScraperProperties props;

    /**
     * Runs with the configured entry points and default options.
     */
    public RunResult run() {
        List<EntryPoint> entries = props.getEntryPoints().stream().map(EntryPoint::from).toList();
        return run(entries, RunOptions.defaults(props), CancellationSignal.none());
    }

    public RunResult run(final List<EntryPoint> entryPoints, final RunOptions options,
                         final CancellationSignal cancellation) {
        if (entryPoints.isEmpty()) {
            throw new IllegalArgumentException("at least one entry point is required");
        }
        log.info("Extraction run started: {} entry point(s), concurrency {}, browser {}, details {}",
                entryPoints.size(), options.maxConcurrency(), options.effectiveBrowserConcurrency(),
                options.fetchDetails());

        ExecutorService pool = Executors.newFixedThreadPool(options.maxConcurrency(),
                new CustomizableThreadFactory("extract-"));
        try (PageFetcher fetcher = fetcherFactory.create(options.fetchPolicy(),
                options.effectiveBrowserConcurrency(), options.browserSlotWait())) {

            Run run = new Run(fetcher, pool, merger.newState(options.conflictPolicy()), cancellation);

            List<FetchTarget> listings = listingTargets(entryPoints, options, fetcher);
            log.info("Listing phase: {} page(s)", listings.size());
            List<PageOutcome> listingOutcomes = run.process(listings);

            List<FetchTarget> details = options.fetchDetails()
                    ? detailTargets(listingOutcomes, options, listings.size())
                    : List.of();
            if (!details.isEmpty()) {
                log.info("Detail phase: {} page(s)", details.size());
                for (PageOutcome outcome : run.process(details)) {
                    if (!outcome.succeeded() && outcome.target().parentRecordId() != null) {
                        run.state.degrade(outcome.target().parentRecordId(),
                                "detail page " + outcome.target().url() + " " + outcome.failure());
                    }
                }
            }

            return finish(run, options);
        } finally {
            pool.shutdownNow();
        }
    }

    private RunResult finish(final Run run, final RunOptions options) {
        List<CanonicalRecord> records = run.state.records();
        int incomplete = (int) records.stream().filter(CanonicalRecord::incomplete).count();
        List<RunError> errors = new ArrayList<>(run.errors);
        errors.sort(Comparator.comparing(RunError::url).thenComparing(RunError::kind));

        RunSummary summary = new RunSummary(run.fetched.get(), run.parsed.get(), incomplete,
                List.copyOf(errors), run.tracker.snapshot(), run.cancellation.isCancelled());
        log.info("Extraction run finished: {} fetched, {} parsed, {} record(s), {} incomplete, {} error(s){}",
                summary.totalFetched(), summary.totalParsed(), records.size(), incomplete, errors.size(),
                summary.cancelled() ? " (cancelled)" : "");

        // skipped targets record no error
        if (summary.totalFetched() == 0 && !errors.isEmpty()) {
            throw new NoDataExtractedException(summary);
        }
        List<Map<String, Object>> rows = options.outputFormat() == OutputFormat.TABLE
                ? tableFormatter.toRows(records)
                : List.of();
        return new RunResult(records, summary, options.outputFormat(), rows);
    }

    private static List<FetchTarget> listingTargets(final List<EntryPoint> entries, final RunOptions options,
                                                    final PageFetcher fetcher) {
        Map<String, FetchTarget> targets = new LinkedHashMap<>();
        for (EntryPoint entry : entries) {
            String base = fetcher.resolve(entry.path());
            for (int page = 1; page <= entry.pages(); page++) {
                String url = page == 1
                        ? base
                        : UriComponentsBuilder.fromUriString(base).replaceQueryParam(PAGE_PARAM, page).toUriString();
                targets.putIfAbsent(url, FetchTarget.of(url, entry.template(),
                        options.renderModeFor(entry.template()), targets.size()));
            }
        }
        return List.copyOf(targets.values());
    }

    /**
     * Detail links in listing order, first parent wins for a shared link.
     */
    private static List<FetchTarget> detailTargets(final List<PageOutcome> listingOutcomes,
                                                   final RunOptions options, final int firstOrdinal) {
        Map<String, FetchTarget> targets = new LinkedHashMap<>();
        Set<String> listingUrls = listingOutcomes.stream().map(o -> o.target().url()).collect(Collectors.toSet());
        for (PageOutcome outcome : listingOutcomes) {
            PageTemplate detail = outcome.target().template().detailTemplate();
            for (Discovery d : outcome.discoveries()) {
                if (!targets.containsKey(d.url()) && !listingUrls.contains(d.url())) {
                    targets.put(d.url(), new FetchTarget(d.url(), detail, options.renderModeFor(detail),
                            firstOrdinal + targets.size(), d.parentRecordId()));
                }
            }
        }
        return List.copyOf(targets.values());
    }

    /** A detail link found on a listing page and the record it belongs to. */
    private record Discovery(String url, String parentRecordId) {
    }

    private record PageOutcome(FetchTarget target, boolean succeeded, String failure, List<Discovery> discoveries) {

        static PageOutcome ok(final FetchTarget target, final List<Discovery> discoveries) {
            return new PageOutcome(target, true, null, discoveries);
        }

        static PageOutcome failed(final FetchTarget target, final String failure) {
            return new PageOutcome(target, false, failure, List.of());
        }
    }

    /**
     * State of one run in progress.
     */
    private final class Run {

        private final PageFetcher fetcher;

        private final ExecutorService pool;

        private final MergeState state;

        private final CancellationSignal cancellation;

        private final TargetTracker tracker = new TargetTracker();

        private final AtomicInteger fetched = new AtomicInteger();

        private final AtomicInteger parsed = new AtomicInteger();

        private final Queue<RunError> errors = new ConcurrentLinkedQueue<>();

        Run(final PageFetcher fetcher, final ExecutorService pool, final MergeState state,
            final CancellationSignal cancellation) {
            this.fetcher = fetcher;
            this.pool = pool;
            this.state = state;
            this.cancellation = cancellation;
        }

        /**
         * Processes a batch of targets on the pool; outcomes come back in
         * target order.
         */
        List<PageOutcome> process(final List<FetchTarget> targets) {
            targets.forEach(tracker::register);
            List<CompletableFuture<PageOutcome>> futures = targets.stream()
                    .map(t -> CompletableFuture.supplyAsync(() -> processOne(t), pool))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            return futures.stream().map(CompletableFuture::join).toList();
        }

        private PageOutcome processOne(final FetchTarget target) {
            if (cancellation.isCancelled()) {
                tracker.move(target, TargetState.SKIPPED);
                return PageOutcome.failed(target, "skipped: run cancelled");
            }

            tracker.move(target, TargetState.FETCHING);
            RawPage page;
            try {
                page = fetcher.fetch(target);
            } catch (FetchException ex) {
                tracker.move(target, TargetState.FAILED);
                errors.add(new RunError(target.url(), ex.getKind().name(), ex.getMessage()));
                log.warn("Fetch failed after {} attempt(s): {}", ex.getAttempts(), ex.getMessage());
                return PageOutcome.failed(target, "failed: " + ex.getKind());
            }
            tracker.move(target, TargetState.FETCHED);
            fetched.incrementAndGet();

            tracker.move(target, TargetState.PARSING);
            List<PartialRecord> partials;
            try {
                partials = parsers.parse(page);
            } catch (ParseException ex) {
                tracker.move(target, TargetState.PARSE_FAILED);
                errors.add(new RunError(target.url(), ex.getKind().name(), ex.getMessage()));
                log.warn("Layout drift: {}", ex.getMessage());
                return PageOutcome.failed(target, "unparseable: " + ex.getKind());
            }
            tracker.move(target, TargetState.PARSED);
            parsed.addAndGet(partials.size());

            List<Discovery> discoveries = new ArrayList<>();
            for (PartialRecord partial : partials) {
                NormalizedFields fields = normalizer.normalize(partial);
                String id = state.merge(fields);
                String detailUrl = partial.field(Fields.DETAIL_URL);
                if (partial.pageType() == PageType.LISTING && StringUtils.isNotBlank(detailUrl)) {
                    discoveries.add(new Discovery(detailUrl.trim(), id));
                }
            }
            return PageOutcome.ok(target, discoveries);
        }
    }
}
