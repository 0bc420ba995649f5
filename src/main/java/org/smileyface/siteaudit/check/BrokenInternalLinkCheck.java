package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.OutcomeKind;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;
import org.smileyface.siteaudit.model.UrlRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Flags links from a page to internal URLs that failed (critical) or answered 4xx (warning).
 * Links that were skipped by robots.txt or never crawled are not judged.
 */
public final class BrokenInternalLinkCheck implements AuditCheck {

    public static final String ID = "broken-internal-link";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml()) return List.of();
        Set<String> links = new LinkedHashSet<>(page.getOutboundLinks());
        links.addAll(page.getResourceLinks());
        List<Finding> out = new ArrayList<>();
        for (String link : links) {
            if (!index.isInternal(link)) continue;
            Optional<UrlRecord> target = index.outcomeOf(link);
            if (target.isEmpty() || !target.get().isBroken()) continue;
            UrlRecord r = target.get();
            boolean failed = r.getOutcome() == OutcomeKind.FAILED;
            out.add(Finding.builder(ID, page.getUrl())
                    .issue(failed ? "link-target-failed" : "link-target-4xx")
                    .severity(failed ? Severity.CRITICAL : Severity.WARNING)
                    .message("Link to " + link + (failed ? " failed" : " returned HTTP " + r.getStatusCode()))
                    .evidence("target", link)
                    .evidence("status", r.getStatusCode())
                    .evidence("error", r.getError())
                    .build());
        }
        return out;
    }
}
