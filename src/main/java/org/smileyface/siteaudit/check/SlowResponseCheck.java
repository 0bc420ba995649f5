package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Flags responses whose fetch latency exceeds the configured threshold.
 */
public final class SlowResponseCheck implements AuditCheck {

    public static final String ID = "slow-response";

    private final long thresholdMs;

    public SlowResponseCheck(Duration threshold) {
        this.thresholdMs = Objects.requireNonNull(threshold, "threshold").toMillis();
    }

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (page.getStatusCode() == 0 || page.getFetchLatencyMs() <= thresholdMs) return List.of();
        return List.of(Finding.builder(ID, page.getUrl())
                .issue("slow-response")
                .severity(Severity.INFO)
                .message("Response took " + page.getFetchLatencyMs() + " ms (threshold " + thresholdMs + " ms)")
                .evidence("latencyMs", page.getFetchLatencyMs())
                .evidence("thresholdMs", thresholdMs)
                .build());
    }
}
