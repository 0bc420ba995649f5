package org.smileyface.siteaudit.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.check.AuditCheck;
import org.smileyface.siteaudit.check.CheckRegistry;
import org.smileyface.siteaudit.crawler.CrawlConfig;
import org.smileyface.siteaudit.crawler.CrawlerProperties;
import org.smileyface.siteaudit.fetch.PageFetcherFactory;
import org.smileyface.siteaudit.model.AuditReport;
import org.smileyface.siteaudit.model.CrawlProgress;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for audits. Each call runs its own {@link CrawlSession}, so concurrent audits never
 * share a frontier, politeness state or results.
 */
@Service
public class SiteAuditService {

    private static final Logger log = LoggerFactory.getLogger(SiteAuditService.class);

    private final CrawlerProperties properties;
    private final PageFetcherFactory fetcherFactory;
    private final CheckRegistry extraChecks;
    private final Map<Long, CrawlSession> active = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    /**
     * @param extraChecks checks registered on top of the built-in ones; their ids must not clash
     */
    public SiteAuditService(CrawlerProperties properties, PageFetcherFactory fetcherFactory, CheckRegistry extraChecks) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.fetcherFactory = Objects.requireNonNull(fetcherFactory, "fetcherFactory");
        this.extraChecks = extraChecks == null ? new CheckRegistry() : extraChecks;
    }

    /**
     * Audits the site at {@code seedUrl} with the configured settings. Blocks until the report is ready.
     */
    public AuditReport audit(String seedUrl) throws InterruptedException {
        return audit(CrawlConfig.from(properties, seedUrl));
    }

    public AuditReport audit(CrawlConfig config) throws InterruptedException {
        CrawlSession session = new CrawlSession(config, fetcherFactory.create(config), registryFor(config));
        long id = ids.incrementAndGet();
        active.put(id, session);
        try {
            return session.run();
        } finally {
            active.remove(id);
        }
    }

    /** Progress of every audit currently running. */
    public List<CrawlProgress> activeProgress() {
        List<CrawlProgress> out = new ArrayList<>();
        for (CrawlSession s : active.values()) {
            out.add(s.progress());
        }
        return out;
    }

    /** Asks every running audit to stop crawling and report on what it has. */
    public int stopAll() {
        int n = 0;
        for (CrawlSession s : active.values()) {
            s.stop();
            n++;
        }
        return n;
    }

    private CheckRegistry registryFor(CrawlConfig config) {
        CheckRegistry registry = CheckRegistry.withDefaults(config.checks());
        for (Map.Entry<String, AuditCheck> e : extraChecks.checks().entrySet()) {
            registry.register(e.getKey(), e.getValue());
        }
        log.debug("Audit of {} uses {} check(s)", config.seedUrl(), registry.checks().size());
        return registry;
    }
}
