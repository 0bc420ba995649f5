package org.smileyface.siteaudit.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.crawler.CrawlTask;
import org.smileyface.siteaudit.fetch.FetchResult;
import org.smileyface.siteaudit.model.OutcomeKind;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.UrlRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.smileyface.siteaudit.util.CrawlerUtils.durationMs;

/**
 * A worker that takes tasks from the frontier, fetches them politely and hands the resulting page
 * models to the session sink. Politeness is enforced per request by the redirecting fetcher.
 * It exits when the frontier is drained or stop() is requested.
 * A failure on one URL is recorded as a FAILED outcome for that URL; it never ends the worker.
 */
public class FetchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FetchWorker.class);

    static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    private final String id;
    private final WorkerContext ctx;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    private volatile WorkerState state = WorkerState.NEW;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public FetchWorker(String id, WorkerContext ctx) {
        this.id = Objects.requireNonNull(id, "id");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public void stop() {
        stopRequested.set(true);
        if (state == WorkerState.NEW) {
            transitionTo(WorkerState.STOPPED, null);
        }
    }

    public WorkerStatus getStatus() {
        return new WorkerStatus(id, state, processedCount.get(), failedCount.get(), lastUrl, lastError,
                startedAt, finishedAt);
    }

    @Override
    public void run() {
        if (state == WorkerState.STOPPED) {
            return;
        }
        transitionTo(WorkerState.RUNNING, null);
        try {
            for (;;) {
                if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                    transitionTo(WorkerState.STOPPED, null);
                    return;
                }
                Optional<CrawlTask> next = ctx.frontier().dequeue();
                if (next.isEmpty()) {
                    if (ctx.frontier().isDrained()) {
                        transitionTo(WorkerState.COMPLETED, null);
                        return;
                    }
                    ctx.frontier().awaitWork(POLL_INTERVAL);
                    continue;
                }
                CrawlTask task = next.get();
                lastUrl = task.url();
                process(task);
                processedCount.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(WorkerState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(WorkerState.ERROR, t);
        }
    }

    /**
     * Centralized state transition with structured logging. Ensures timestamps are set
     * and duration is included for terminal states (STOPPED/COMPLETED/ERROR).
     */
    private void transitionTo(WorkerState newState, Throwable error) {
        WorkerState old = this.state;
        if (newState == WorkerState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = WorkerState.RUNNING;
            log.info("Worker {} state {} -> {} (startedAt={})", id, old, this.state, startedAt);
            return;
        }

        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? durationMs(startedAt, finishedAt) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Worker {} state {} -> STOPPED after {} ms (processed={}, lastUrl={})", id, old, dur, count, lastUrl);
            case COMPLETED -> log.info("Worker {} state {} -> COMPLETED after {} ms (processed={}, failed={})", id, old, dur, count, failedCount.get());
            case ERROR -> log.error("Worker {} state {} -> ERROR after {} ms (processed={}, lastUrl={}, error={})", id, old, dur, count, lastUrl, lastError, error);
            default -> log.info("Worker {} state {} -> {}", id, old, newState);
        }
    }

    private void process(CrawlTask task) throws InterruptedException {
        String url = task.url();
        UrlRecord record = null;
        boolean sunk = false;
        try {
            if (!ctx.gate().mayFetch(url)) {
                log.debug("Worker {} skipping {}: disallowed by robots.txt", id, url);
                record = UrlRecord.skippedByRobots(url, task.depth(), task.parent());
                return;
            }
            FetchResult result = ctx.retryPolicy().execute(url, () -> ctx.fetcher().fetch(url));
            PageModel page = ctx.builder().build(task, result);
            ctx.sink().accept(page);
            sunk = true;
            record = toRecord(task, result);
            log.debug("Worker {} fetched {} -> {} (status={}, attempts={}, {} ms)", id, url, record.getOutcome(),
                    record.getStatusCode(), record.getAttempts(), result.getLatencyMs());
            if (record.getOutcome() == OutcomeKind.FETCHED) {
                discover(task, result, page);
            }
        } catch (InterruptedException e) {
            record = failed(task, "Interrupted");
            throw e;
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            lastError = e.toString();
            log.error("Worker {} failed to process {}", id, url, e);
            record = failed(task, e.toString());
            if (!sunk) {
                ctx.sink().accept(PageModel.builder(url).depth(task.depth()).fetchError(e.toString()).build());
            }
        } finally {
            ctx.frontier().markVisited(url, record != null ? record : failed(task, "No outcome"));
        }
    }

    private void discover(CrawlTask task, FetchResult result, PageModel page) {
        if (!result.getFinalUrl().equals(task.url())) {
            enqueueIfCrawlable(task, result.getFinalUrl());
        }
        if (result.isRobotsBlocked()) {
            // recorded as skipped by its own task, never fetched
            enqueueIfCrawlable(task, result.getRobotsBlockedUrl());
        }
        if (!page.isAuditableHtml()) {
            return;
        }
        for (String link : page.getOutboundLinks()) {
            enqueueIfCrawlable(task, link);
        }
        if (ctx.crawlResources()) {
            for (String link : page.getResourceLinks()) {
                enqueueIfCrawlable(task, link);
            }
        }
    }

    private void enqueueIfCrawlable(CrawlTask parent, String link) {
        if (ctx.scope().isCrawlable(link)) {
            ctx.frontier().enqueue(parent.child(link));
        }
    }

    static UrlRecord toRecord(CrawlTask task, FetchResult result) {
        OutcomeKind outcome;
        int status = result.getStatusCode();
        if (result.isRobotsBlocked() && !result.hasResponse()) {
            outcome = OutcomeKind.SKIPPED_ROBOTS;
        } else if (result.getMalformedLocation() != null) {
            outcome = OutcomeKind.MALFORMED;
        } else if (result.getFailure() != null || result.isRedirectLoop() || result.isTooManyRedirects()) {
            outcome = OutcomeKind.FAILED;
        } else if (status >= 500 || status == 429) {
            outcome = OutcomeKind.FAILED;
        } else {
            outcome = OutcomeKind.FETCHED;
        }
        String error = result.errorMessage();
        if (error == null && outcome == OutcomeKind.FAILED) {
            error = "HTTP " + status + " after " + result.getAttempts() + " attempt(s)";
        }
        return new UrlRecord(task.url(), result.getFinalUrl(), result.hasResponse() ? status : null, outcome,
                task.depth(), task.parent(), result.getAttempts(), error);
    }

    private static UrlRecord failed(CrawlTask task, String error) {
        return new UrlRecord(task.url(), null, null, OutcomeKind.FAILED, task.depth(), task.parent(), 0, error);
    }
}
