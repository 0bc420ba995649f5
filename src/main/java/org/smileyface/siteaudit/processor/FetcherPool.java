package org.smileyface.siteaudit.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages the FetchWorkers of one crawl session on a fixed-size thread pool.
 * Provides APIs to start, stop and query statuses of workers.
 */
public class FetcherPool {

    private static final Logger log = LogManager.getLogger();

    private final List<FetchWorker> workers = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final String name;
    private ExecutorService executor;

    public FetcherPool(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public synchronized void start(int numWorkers, WorkerContext ctx) {
        if (running.get()) {
            throw new IllegalStateException("FetcherPool " + name + " already running");
        }
        Objects.requireNonNull(ctx, "ctx");
        int n = Math.max(1, numWorkers);
        workers.clear();
        futures.clear();
        executor = Executors.newFixedThreadPool(n, threadFactory(name));
        for (int i = 0; i < n; i++) {
            String id = "worker-" + UUID.randomUUID();
            FetchWorker w = new FetchWorker(id, ctx);
            workers.add(w);
            futures.add(executor.submit(w));
        }
        running.set(true);
        log.info("FetcherPool {} STARTED with {} workers", name, n);
    }

    public synchronized void stopAll() {
        for (FetchWorker w : workers) {
            w.stop();
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.error("FetcherPool {}: worker ended abnormally", name, e.getCause());
            }
        }
        shutdown();
        logAggregate("STOPPED");
    }

    public List<WorkerStatus> getStatuses() {
        List<WorkerStatus> list = new ArrayList<>(workers.size());
        for (FetchWorker w : workers) {
            list.add(w.getStatus());
        }
        return list;
    }

    public boolean isRunning() {
        if (!running.get()) return false;
        for (Future<?> f : futures) {
            if (!f.isDone()) return true;
        }
        return false;
    }

    /**
     * Wait until all workers exit or the timeout elapses.
     * @param timeout maximum wait, null to wait until the frontier drains
     * @return true if all workers finished before timeout, false otherwise.
     */
    public boolean awaitAll(Duration timeout) throws InterruptedException {
        long remainingMs = timeout == null ? Long.MAX_VALUE / 2_000_000L : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline - System.nanoTime();
            if (nanosLeft <= 0) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            }
            try {
                f.get(nanosLeft, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (ExecutionException e) {
                log.error("FetcherPool {}: worker ended abnormally", name, e.getCause());
            }
        }
        shutdown();
        logAggregate("ALL COMPLETED");
        return true;
    }

    private void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        running.set(false);
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        long failed = 0L;
        List<WorkerStatus> statuses = getStatuses();
        for (WorkerStatus s : statuses) {
            processed += s.getProcessedCount();
            failed += s.getFailedCount();
            WorkerState st = s.getState();
            if (st == WorkerState.COMPLETED) completed++;
            else if (st == WorkerState.STOPPED) stopped++;
            else if (st == WorkerState.ERROR) error++;
        }
        log.info("FetcherPool {} {}: workers -> completed={}, stopped={}, error={}, totalProcessed={}, failed={} (workers={})",
                name, event, completed, stopped, error, processed, failed, statuses.size());
    }

    private static ThreadFactory threadFactory(String poolName) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, poolName + "-fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
