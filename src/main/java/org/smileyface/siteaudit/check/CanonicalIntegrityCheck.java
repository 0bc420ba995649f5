package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;
import org.smileyface.siteaudit.model.UrlRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The canonical link must be a valid URL, should agree with where a redirect landed, and must not
 * point at an internal URL that turned out broken.
 */
public final class CanonicalIntegrityCheck implements AuditCheck {

    public static final String ID = "canonical-integrity";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml()) return List.of();
        List<Finding> out = new ArrayList<>();
        if (page.getCanonicalRaw() != null) {
            out.add(Finding.builder(ID, page.getUrl()).issue("malformed-canonical").severity(Severity.WARNING)
                    .message("Canonical link is not a valid URL: " + page.getCanonicalRaw())
                    .evidence("href", page.getCanonicalRaw())
                    .build());
        }
        String canonical = page.getCanonical();
        if (canonical == null) return out;

        // the redirect target wins over the declared canonical
        if (page.isRedirected() && !canonical.equals(page.getFinalUrl())) {
            out.add(Finding.builder(ID, page.getUrl()).issue("canonical-redirect-conflict").severity(Severity.INFO)
                    .message("Redirect lands on " + page.getFinalUrl() + " but canonical is " + canonical)
                    .evidence("finalUrl", page.getFinalUrl())
                    .evidence("canonical", canonical)
                    .build());
        }
        if (index.isInternal(canonical)) {
            Optional<UrlRecord> target = index.outcomeOf(canonical);
            if (target.isPresent() && target.get().isBroken()) {
                out.add(Finding.builder(ID, page.getUrl()).issue("canonical-target-broken").severity(Severity.WARNING)
                        .message("Canonical target " + canonical + " is broken")
                        .evidence("canonical", canonical)
                        .evidence("status", target.get().getStatusCode())
                        .evidence("error", target.get().getError())
                        .build());
            }
        }
        return out;
    }
}
