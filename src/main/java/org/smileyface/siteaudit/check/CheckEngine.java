package org.smileyface.siteaudit.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every enabled check over every page on a bounded pool and returns the findings in report order.
 * A check that throws yields an INFO {@code check-error} finding for that page; the run goes on.
 */
public class CheckEngine {

    private static final Logger log = LoggerFactory.getLogger(CheckEngine.class);

    public static final String CHECK_ERROR = "check-error";

    private final Map<String, AuditCheck> checks;
    private final int parallelism;

    /**
     * @param registry    checks to run
     * @param disabled    ids to skip
     * @param parallelism number of pages checked concurrently
     */
    public CheckEngine(CheckRegistry registry, Set<String> disabled, int parallelism) {
        Objects.requireNonNull(registry, "registry");
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1");
        Map<String, AuditCheck> enabled = new LinkedHashMap<>(registry.checks());
        if (disabled != null) {
            enabled.keySet().removeAll(disabled);
        }
        this.checks = Collections.unmodifiableMap(enabled);
        this.parallelism = parallelism;
    }

    public Set<String> enabledChecks() {
        return checks.keySet();
    }

    public List<Finding> run(Collection<PageModel> pages, CrawlIndex index) throws InterruptedException {
        List<Finding> findings = new ArrayList<>();
        if (pages.isEmpty() || checks.isEmpty()) {
            return findings;
        }
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, pages.size()), r -> {
            Thread t = new Thread(r, "audit-check-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<List<Finding>>> futures = new ArrayList<>(pages.size());
            for (PageModel page : pages) {
                Callable<List<Finding>> task = () -> checkPage(page, index);
                futures.add(pool.submit(task));
            }
            for (Future<List<Finding>> f : futures) {
                try {
                    findings.addAll(f.get());
                } catch (ExecutionException e) {
                    // checkPage traps check failures, so this is a bug in the engine itself
                    throw new IllegalStateException("Check task failed", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        findings.sort(Finding.REPORT_ORDER);
        log.info("Checks finished: {} page(s), {} check(s), {} finding(s)", pages.size(), checks.size(), findings.size());
        return findings;
    }

    private List<Finding> checkPage(PageModel page, CrawlIndex index) {
        List<Finding> out = new ArrayList<>();
        for (Map.Entry<String, AuditCheck> e : checks.entrySet()) {
            try {
                List<Finding> found = e.getValue().check(page, index);
                if (found != null) out.addAll(found);
            } catch (RuntimeException ex) {
                log.warn("Check {} failed on {}: {}", e.getKey(), page.getUrl(), ex.toString(), ex);
                out.add(Finding.builder(e.getKey(), page.getUrl())
                        .issue(CHECK_ERROR)
                        .severity(Severity.INFO)
                        .message("Check failed: " + ex)
                        .evidence("exception", ex.getClass().getName())
                        .build());
            }
        }
        return out;
    }
}
