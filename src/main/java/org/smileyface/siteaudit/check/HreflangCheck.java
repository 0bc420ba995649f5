package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Alternate-language links need a well-formed language tag and an absolute http(s) URL. */
public final class HreflangCheck implements AuditCheck {

    public static final String ID = "hreflang-validity";

    // language, optional script, optional region
    static final Pattern LANG_TAG = Pattern.compile(
            "(?i)x-default|[a-z]{2,3}(-[a-z]{4})?(-([a-z]{2}|[0-9]{3}))?");

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml()) return List.of();
        List<Finding> out = new ArrayList<>();
        for (PageModel.Hreflang alt : page.getHreflangs()) {
            if (!LANG_TAG.matcher(alt.lang()).matches()) {
                out.add(Finding.builder(ID, page.getUrl()).issue("invalid-hreflang").severity(Severity.WARNING)
                        .message("Invalid hreflang value '" + alt.lang() + "'")
                        .evidence("hreflang", alt.lang())
                        .evidence("href", alt.url())
                        .build());
            }
            String url = alt.url();
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                out.add(Finding.builder(ID, page.getUrl()).issue("invalid-hreflang-url").severity(Severity.WARNING)
                        .message("hreflang '" + alt.lang() + "' points at an invalid URL: " + url)
                        .evidence("hreflang", alt.lang())
                        .evidence("href", url)
                        .build());
            }
        }
        return out;
    }
}
