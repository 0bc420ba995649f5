package org.smileyface.siteaudit.crawler;

import org.smileyface.siteaudit.model.TerminationReason;
import org.smileyface.siteaudit.model.UrlRecord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The set of discovered, not-yet-fetched crawl tasks plus the record of every URL already visited.
 * A normalized URL is admitted at most once per session; re-discovery of a queued, in-flight or
 * visited URL is a no-op.
 */
public interface Frontier {

    /**
     * Admits the task when its URL is new, its depth is within the limit, the page budget is not
     * spent and the deadline has not passed.
     *
     * @return true when the task was queued
     */
    boolean enqueue(CrawlTask task);

    /**
     * Next task in FIFO order, marked in flight. Empty when the queue is empty, or after the deadline
     * has passed, in which case the remaining queue is abandoned.
     */
    Optional<CrawlTask> dequeue();

    /**
     * Blocks until a task may be available, the frontier drains or the timeout elapses.
     *
     * @return true when work is queued or the frontier is drained
     */
    boolean awaitWork(Duration timeout) throws InterruptedException;

    /**
     * Records the terminal state of a dequeued URL and releases its in-flight slot.
     * A second call for the same URL is ignored.
     */
    void markVisited(String url, UrlRecord record);

    /** True when nothing is queued and nothing is in flight. */
    boolean isDrained();

    /** Abandons the queued tasks; tasks in flight still complete. */
    void stop();

    FrontierStats stats();

    /** Terminal records in visit order. */
    List<UrlRecord> inventory();

    TerminationReason terminationReason();
}
