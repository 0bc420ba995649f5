package org.smileyface.siteaudit.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.model.TerminationReason;
import org.smileyface.siteaudit.model.UrlRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link Frontier} for a single crawl session.
 * <p>
 * An {@link ArrayDeque} gives FIFO order and a plain {@link HashSet} holds every URL ever admitted
 * (queued, in flight or visited). Both live behind one {@link ReentrantLock} together with the
 * in-flight set and the inventory, so the check-then-insert on enqueue and the drain test see one
 * consistent state. Nothing inside the lock does I/O.
 */
public class InMemoryFrontier implements Frontier {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFrontier.class);

    private final int maxDepth;
    private final int maxPages;
    private final Instant deadline;     // null for no time limit
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workChanged = lock.newCondition();

    private final Deque<CrawlTask> queue = new ArrayDeque<>();
    private final Set<String> known = new HashSet<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Map<String, UrlRecord> inventory = new LinkedHashMap<>();

    private long refusedByBudget;
    private long abandoned;
    private boolean deadlineHit;
    private boolean stopped;

    /**
     * @param maxDepth  deepest depth admitted, the seed being depth 0
     * @param maxPages  maximum number of URLs ever admitted
     * @param deadline  instant after which no work is admitted or handed out, null for none
     * @param clock     time source for the deadline
     */
    public InMemoryFrontier(int maxDepth, int maxPages, Instant deadline, Clock clock) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.maxDepth = maxDepth;
        this.maxPages = maxPages;
        this.deadline = deadline;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public InMemoryFrontier(int maxDepth, int maxPages) {
        this(maxDepth, maxPages, null, Clock.systemUTC());
    }

    /** Frontier bounded by the session's depth, page and time budgets, the clock starting now. */
    public static InMemoryFrontier forConfig(CrawlConfig config, Clock clock) {
        Instant deadline = config.hasTimeLimit() ? clock.instant().plus(config.timeLimit()) : null;
        return new InMemoryFrontier(config.maxDepth(), config.maxPages(), deadline, clock);
    }

    @Override
    public boolean enqueue(CrawlTask task) {
        if (task == null) return false;
        lock.lock();
        try {
            if (known.contains(task.url())) {
                return false;
            }
            if (task.depth() > maxDepth) {
                return false;
            }
            if (stopped || checkDeadline()) {
                return false;
            }
            if (known.size() >= maxPages) {
                if (refusedByBudget++ == 0) {
                    log.info("Page budget of {} reached; further discoveries are not admitted (first refused: {})",
                            maxPages, task.url());
                }
                return false;
            }
            known.add(task.url());
            queue.addLast(task);
            workChanged.signalAll();
            log.debug("Enqueued {} (depth={}, parent={})", task.url(), task.depth(), task.parent());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CrawlTask> dequeue() {
        lock.lock();
        try {
            if (checkDeadline()) {
                return Optional.empty();
            }
            CrawlTask next = queue.pollFirst();
            if (next == null) {
                return Optional.empty();
            }
            inFlight.add(next.url());
            return Optional.of(next);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitWork(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            checkDeadline();
            if (!queue.isEmpty() || isDrainedLocked()) {
                return true;
            }
            workChanged.await(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
            checkDeadline();
            return !queue.isEmpty() || isDrainedLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markVisited(String url, UrlRecord record) {
        lock.lock();
        try {
            if (inventory.containsKey(url)) {
                log.warn("Ignoring second terminal record for {}: kept {}, dropped {}",
                        url, inventory.get(url).getOutcome(), record.getOutcome());
                return;
            }
            if (!known.contains(url)) {
                log.warn("Ignoring terminal record for {} which was never admitted", url);
                return;
            }
            inFlight.remove(url);
            inventory.put(url, record);
            workChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isDrained() {
        lock.lock();
        try {
            checkDeadline();
            return isDrainedLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            if (!stopped) {
                stopped = true;
                abandonQueue();
                log.info("Frontier stopped; {} queued task(s) abandoned", abandoned);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FrontierStats stats() {
        lock.lock();
        try {
            return new FrontierStats(queue.size(), inFlight.size(), inventory.size(), known.size(),
                    refusedByBudget, abandoned);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<UrlRecord> inventory() {
        lock.lock();
        try {
            return List.copyOf(inventory.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TerminationReason terminationReason() {
        lock.lock();
        try {
            if (deadlineHit) return TerminationReason.DEADLINE;
            if (stopped) return TerminationReason.STOPPED;
            if (refusedByBudget > 0) return TerminationReason.MAX_PAGES;
            return TerminationReason.DRAINED;
        } finally {
            lock.unlock();
        }
    }

    private boolean isDrainedLocked() {
        return queue.isEmpty() && inFlight.isEmpty();
    }

    /** Must hold the lock. Abandons the queue the first time the deadline is seen as passed. */
    private boolean checkDeadline() {
        if (deadlineHit) {
            return true;
        }
        if (deadline == null || clock.instant().isBefore(deadline)) {
            return false;
        }
        deadlineHit = true;
        abandonQueue();
        log.info("Crawl deadline {} passed; {} queued task(s) abandoned", deadline, abandoned);
        return true;
    }

    private void abandonQueue() {
        abandoned += queue.size();
        queue.clear();
        workChanged.signalAll();
    }
}
