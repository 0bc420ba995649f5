package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags HTML pages whose normalized body hash equals that of another visited URL. Exact match only.
 */
public final class DuplicateContentCheck implements AuditCheck {

    public static final String ID = "duplicate-content";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml() || page.getBodyHash() == null) return List.of();
        Set<String> others = new TreeSet<>(index.urlsWithBodyHash(page.getBodyHash()));
        others.remove(page.getUrl());
        if (others.isEmpty()) return List.of();
        return List.of(Finding.builder(ID, page.getUrl()).issue("duplicate-body").severity(Severity.WARNING)
                .message("Body identical to " + others.size() + " other page(s)")
                .evidence("duplicates", String.join(", ", others))
                .evidence("bodyHash", page.getBodyHash())
                .build());
    }
}
