package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.List;
import java.util.Locale;

/** Notes pages that opt out of indexing via a robots meta tag or an X-Robots-Tag header. */
public final class IndexabilityCheck implements AuditCheck {

    public static final String ID = "indexability";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isSuccess()) return List.of();
        String source = null;
        String value = null;
        if (page.isHtml() && hasNoindex(page.meta("robots"))) {
            source = "meta";
            value = page.meta("robots");
        } else if (hasNoindex(page.header("X-Robots-Tag"))) {
            source = "header";
            value = page.header("X-Robots-Tag");
        }
        if (source == null) return List.of();
        return List.of(Finding.builder(ID, page.getUrl())
                .issue("noindex")
                .severity(Severity.INFO)
                .message("Page is excluded from indexing (" + source + ": " + value + ")")
                .evidence("source", source)
                .evidence("value", value)
                .build());
    }

    static boolean hasNoindex(String directives) {
        if (directives == null) return false;
        for (String token : directives.toLowerCase(Locale.ROOT).split("[,\\s]+")) {
            if (token.equals("noindex") || token.equals("none")) return true;
        }
        return false;
    }
}
