package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Heading outline: exactly one h1, and no level skipped on the way down (h2 followed by h4).
 */
public final class HeadingStructureCheck implements AuditCheck {

    public static final String ID = "heading-structure";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml()) return List.of();
        List<PageModel.Heading> headings = page.getHeadings();
        List<Finding> out = new ArrayList<>();
        long h1 = headings.stream().filter(h -> h.level() == 1).count();
        if (h1 == 0) {
            out.add(Finding.builder(ID, page.getUrl()).issue("missing-h1").severity(Severity.WARNING)
                    .message("No h1 heading")
                    .build());
        } else if (h1 > 1) {
            out.add(Finding.builder(ID, page.getUrl()).issue("multiple-h1").severity(Severity.INFO)
                    .message(h1 + " h1 headings")
                    .evidence("count", h1)
                    .build());
        }
        int previous = 0;
        for (PageModel.Heading h : headings) {
            if (previous > 0 && h.level() > previous + 1) {
                out.add(Finding.builder(ID, page.getUrl()).issue("heading-level-skipped").severity(Severity.INFO)
                        .message("h" + previous + " followed by h" + h.level())
                        .evidence("from", "h" + previous)
                        .evidence("to", "h" + h.level())
                        .evidence("text", h.text())
                        .build());
            }
            previous = h.level();
        }
        return out;
    }
}
