package org.smileyface.siteaudit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The finished result of one crawl session: URL inventory, findings in report order and summary counters.
 * This is the only artifact handed to reporting collaborators; it is immutable once assembled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AuditReport {

    private final String seedUrl;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final TerminationReason terminationReason;
    private final Map<String, UrlRecord> inventory;
    private final List<Finding> findings;
    private final AuditSummary summary;

    public AuditReport(String seedUrl, Instant startedAt, Instant finishedAt, TerminationReason terminationReason,
                       Collection<UrlRecord> inventory, Collection<Finding> findings, long abandoned) {
        this.seedUrl = Objects.requireNonNull(seedUrl, "seedUrl");
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.terminationReason = terminationReason;
        Map<String, UrlRecord> byUrl = new TreeMap<>();
        for (UrlRecord r : inventory) {
            byUrl.put(r.getUrl(), r);
        }
        this.inventory = Collections.unmodifiableMap(byUrl);
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(Finding.REPORT_ORDER);
        this.findings = List.copyOf(sorted);
        this.summary = AuditSummary.of(byUrl.values(), this.findings, abandoned);
    }

    public String getSeedUrl() { return seedUrl; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public TerminationReason getTerminationReason() { return terminationReason; }
    public Map<String, UrlRecord> getInventory() { return inventory; }
    public List<Finding> getFindings() { return findings; }
    public AuditSummary getSummary() { return summary; }

    public UrlRecord record(String url) {
        return inventory.get(url);
    }

    public List<Finding> findingsFor(String url) {
        return findings.stream().filter(f -> f.getUrl().equals(url)).collect(Collectors.toList());
    }

    public List<Finding> findingsOf(String checkId) {
        return findings.stream().filter(f -> f.getCheckId().equals(checkId)).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "AuditReport{" +
                "seedUrl='" + seedUrl + '\'' +
                ", startedAt=" + startedAt +
                ", finishedAt=" + finishedAt +
                ", terminationReason=" + terminationReason +
                ", urls=" + inventory.size() +
                ", findings=" + findings.size() +
                ", summary=" + summary +
                '}';
    }
}
