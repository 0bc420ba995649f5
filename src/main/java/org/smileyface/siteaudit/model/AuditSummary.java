package org.smileyface.siteaudit.model;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Summary counters of an audit: URL outcomes and findings by severity and by check.
 */
public final class AuditSummary {

    private final long pagesFetched;
    private final long pagesSkippedRobots;
    private final long pagesFailed;
    private final long pagesMalformed;
    private final long uniqueFinalUrls;
    private final long abandoned;
    private final Map<Severity, Long> findingsBySeverity;
    private final Map<String, Long> findingsByCheck;

    public AuditSummary(long pagesFetched, long pagesSkippedRobots, long pagesFailed, long pagesMalformed,
                        long uniqueFinalUrls, long abandoned,
                        Map<Severity, Long> findingsBySeverity, Map<String, Long> findingsByCheck) {
        this.pagesFetched = pagesFetched;
        this.pagesSkippedRobots = pagesSkippedRobots;
        this.pagesFailed = pagesFailed;
        this.pagesMalformed = pagesMalformed;
        this.uniqueFinalUrls = uniqueFinalUrls;
        this.abandoned = abandoned;
        this.findingsBySeverity = Map.copyOf(findingsBySeverity);
        this.findingsByCheck = Map.copyOf(findingsByCheck);
    }

    /**
     * Computes the counters from a finished inventory and finding list.
     */
    public static AuditSummary of(Collection<UrlRecord> inventory, Collection<Finding> findings, long abandoned) {
        long fetched = 0, skipped = 0, failed = 0, malformed = 0;
        Set<String> finalUrls = new HashSet<>();
        for (UrlRecord r : inventory) {
            switch (r.getOutcome()) {
                case FETCHED -> fetched++;
                case SKIPPED_ROBOTS -> skipped++;
                case FAILED -> failed++;
                case MALFORMED -> malformed++;
            }
            if (r.getOutcome() == OutcomeKind.FETCHED) {
                finalUrls.add(r.getFinalUrl() != null ? r.getFinalUrl() : r.getUrl());
            }
        }
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            bySeverity.put(s, 0L);
        }
        Map<String, Long> byCheck = new TreeMap<>();
        for (Finding f : findings) {
            bySeverity.merge(f.getSeverity(), 1L, Long::sum);
            byCheck.merge(f.getCheckId(), 1L, Long::sum);
        }
        return new AuditSummary(fetched, skipped, failed, malformed, finalUrls.size(), abandoned, bySeverity, byCheck);
    }

    public long getPagesFetched() { return pagesFetched; }
    public long getPagesSkippedRobots() { return pagesSkippedRobots; }
    public long getPagesFailed() { return pagesFailed; }
    public long getPagesMalformed() { return pagesMalformed; }
    public long getUniqueFinalUrls() { return uniqueFinalUrls; }
    public long getAbandoned() { return abandoned; }
    public Map<Severity, Long> getFindingsBySeverity() { return findingsBySeverity; }
    public Map<String, Long> getFindingsByCheck() { return findingsByCheck; }

    public long findings(Severity severity) {
        return findingsBySeverity.getOrDefault(severity, 0L);
    }

    @Override
    public String toString() {
        return "AuditSummary{" +
                "pagesFetched=" + pagesFetched +
                ", pagesSkippedRobots=" + pagesSkippedRobots +
                ", pagesFailed=" + pagesFailed +
                ", pagesMalformed=" + pagesMalformed +
                ", uniqueFinalUrls=" + uniqueFinalUrls +
                ", abandoned=" + abandoned +
                ", findingsBySeverity=" + findingsBySeverity +
                '}';
    }
}
