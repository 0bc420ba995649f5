package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.List;

/** Reports the HTML parser errors recorded for a page. */
public final class MalformedMarkupCheck implements AuditCheck {

    public static final String ID = "malformed-markup";

    private static final int SAMPLE = 5;

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        List<String> errors = page.getParseErrors();
        if (!page.isAuditableHtml() || errors.isEmpty()) return List.of();
        return List.of(Finding.builder(ID, page.getUrl())
                .issue("parse-errors")
                .severity(Severity.INFO)
                .message(errors.size() + " HTML parse error(s)")
                .evidence("count", errors.size())
                .evidence("sample", String.join(" | ", errors.subList(0, Math.min(SAMPLE, errors.size()))))
                .build());
    }
}
