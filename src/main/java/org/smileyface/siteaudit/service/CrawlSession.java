package org.smileyface.siteaudit.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.check.CheckEngine;
import org.smileyface.siteaudit.check.CheckRegistry;
import org.smileyface.siteaudit.check.CrawlIndex;
import org.smileyface.siteaudit.crawler.CrawlConfig;
import org.smileyface.siteaudit.crawler.CrawlScope;
import org.smileyface.siteaudit.crawler.CrawlTask;
import org.smileyface.siteaudit.crawler.FrontierStats;
import org.smileyface.siteaudit.crawler.InMemoryFrontier;
import org.smileyface.siteaudit.crawler.PolitenessGate;
import org.smileyface.siteaudit.extractor.PageModelBuilder;
import org.smileyface.siteaudit.fetch.PageFetcher;
import org.smileyface.siteaudit.fetch.RedirectingFetcher;
import org.smileyface.siteaudit.fetch.RetryPolicy;
import org.smileyface.siteaudit.model.AuditReport;
import org.smileyface.siteaudit.model.CrawlProgress;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.UrlRecord;
import org.smileyface.siteaudit.processor.FetcherPool;
import org.smileyface.siteaudit.processor.WorkerContext;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.smileyface.siteaudit.util.CrawlerUtils.durationMs;

/**
 * One audit from seed to report: crawl the site with a pool of workers, then run the checks over the
 * collected pages. A session runs once; every piece of crawl state lives here and dies with it.
 */
public class CrawlSession {

    private static final Logger log = LoggerFactory.getLogger(CrawlSession.class);

    private final CrawlConfig config;
    private final CheckRegistry registry;
    private final Clock clock;
    private final InMemoryFrontier frontier;
    private final FetcherPool pool;
    private final WorkerContext context;
    private final CrawlScope scope;
    private final Queue<PageModel> pages = new ConcurrentLinkedQueue<>();

    private volatile CrawlProgress.Phase phase = CrawlProgress.Phase.CRAWLING;
    private volatile Instant startedAt;
    private volatile boolean started;

    public CrawlSession(CrawlConfig config, PageFetcher fetcher, CheckRegistry registry, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(fetcher, "fetcher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.frontier = InMemoryFrontier.forConfig(config, this.clock);
        this.scope = config.scope();
        this.pool = new FetcherPool("audit-" + Integer.toHexString(System.identityHashCode(this)));
        PolitenessGate gate = PolitenessGate.forConfig(fetcher, config);
        this.context = new WorkerContext(
                frontier,
                gate,
                new RedirectingFetcher(fetcher, gate, config.normalizer(), config.maxRedirects()),
                RetryPolicy.forConfig(config),
                new PageModelBuilder(config.normalizer()),
                scope,
                config.crawlResources(),
                pages::add);
    }

    public CrawlSession(CrawlConfig config, PageFetcher fetcher, CheckRegistry registry) {
        this(config, fetcher, registry, Clock.systemUTC());
    }

    public CrawlConfig getConfig() {
        return config;
    }

    /**
     * Crawls until the frontier drains, a budget is exhausted or {@link #stop()} is called, then
     * audits what was collected.
     *
     * @throws InterruptedException when the calling thread is interrupted; the workers are stopped first
     */
    public AuditReport run() throws InterruptedException {
        synchronized (this) {
            if (started) throw new IllegalStateException("Session already run");
            started = true;
        }
        startedAt = clock.instant();
        log.info("Audit of {} started (maxDepth={}, maxPages={}, workers={}, timeLimit={})", config.seedUrl(),
                config.maxDepth(), config.maxPages(), config.workerCount(), config.timeLimit());
        frontier.enqueue(CrawlTask.seed(config.seedUrl()));
        pool.start(config.workerCount(), context);
        try {
            pool.awaitAll(null);
        } catch (InterruptedException e) {
            frontier.stop();
            pool.stopAll();
            throw e;
        }

        List<UrlRecord> inventory = frontier.inventory();
        FrontierStats stats = frontier.stats();
        log.info("Crawl of {} finished: {} URL(s) visited, {} refused by budget, {} abandoned, reason={}",
                config.seedUrl(), stats.visited(), stats.refusedByBudget(), stats.abandoned(),
                frontier.terminationReason());

        phase = CrawlProgress.Phase.CHECKING;
        List<PageModel> collected = new ArrayList<>(pages);
        CrawlIndex index = CrawlIndex.of(collected, inventory, scope);
        CheckEngine engine = new CheckEngine(registry, config.checks().disabled(), config.checks().checkParallelism());
        List<Finding> findings = engine.run(collected, index);

        Instant finishedAt = clock.instant();
        AuditReport report = new AuditReport(config.seedUrl(), startedAt, finishedAt, frontier.terminationReason(),
                inventory, findings, stats.abandoned());
        phase = CrawlProgress.Phase.DONE;
        log.info("Audit of {} done in {} ms: {}", config.seedUrl(), durationMs(startedAt, finishedAt),
                report.getSummary());
        return report;
    }

    /** Stops admitting and handing out work; in-flight fetches finish and the audit runs on what was collected. */
    public void stop() {
        log.info("Stop requested for audit of {}", config.seedUrl());
        frontier.stop();
    }

    public CrawlProgress progress() {
        FrontierStats s = frontier.stats();
        return new CrawlProgress(config.seedUrl(), startedAt, phase, s.queued(), s.inFlight(), s.visited(),
                s.admitted(), pool.getStatuses().size());
    }
}
