package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;

/** One warning per link on the page that could not be turned into a URL. */
public final class MalformedLinkCheck implements AuditCheck {

    public static final String ID = "malformed-link";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        List<Finding> out = new ArrayList<>();
        for (String raw : page.getMalformedLinks()) {
            out.add(Finding.builder(ID, page.getUrl())
                    .issue("malformed-link")
                    .severity(Severity.WARNING)
                    .message("Link is not a valid URL: " + raw)
                    .evidence("href", raw)
                    .build());
        }
        return out;
    }
}
