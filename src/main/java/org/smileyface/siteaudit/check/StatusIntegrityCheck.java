package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.RedirectHop;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags fetches that did not end in a usable response: no response at all, error statuses,
 * broken redirect chains and chains longer than the configured hop limit. Also notes redirects into
 * paths robots.txt disallows and bodies cut at the size limit.
 */
public final class StatusIntegrityCheck implements AuditCheck {

    public static final String ID = "status-integrity";

    private final int redirectHopLimit;

    /**
     * @param redirectHopLimit longest acceptable redirect chain; negative values are treated as zero
     */
    public StatusIntegrityCheck(int redirectHopLimit) {
        this.redirectHopLimit = Math.max(0, redirectHopLimit);
    }

    public int getRedirectHopLimit() {
        return redirectHopLimit;
    }

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        List<Finding> out = new ArrayList<>();
        String url = page.getUrl();
        if (page.isRedirectLoop()) {
            out.add(Finding.builder(ID, url).issue("redirect-loop").severity(Severity.CRITICAL)
                    .message("Redirect chain loops back to " + page.getFinalUrl())
                    .evidence("chain", chain(page))
                    .build());
            return out;
        }
        if (page.isTooManyRedirects()) {
            out.add(Finding.builder(ID, url).issue("too-many-redirects").severity(Severity.CRITICAL)
                    .message("Gave up after " + page.getRedirectChain().size() + " redirects")
                    .evidence("chain", chain(page))
                    .build());
            return out;
        }
        if (page.getRobotsBlockedUrl() != null) {
            out.add(Finding.builder(ID, url).issue("redirect-disallowed").severity(Severity.INFO)
                    .message("Redirects to " + page.getRobotsBlockedUrl() + ", which robots.txt disallows")
                    .evidence("target", page.getRobotsBlockedUrl())
                    .evidence("status", page.getStatusCode())
                    .build());
            return out;
        }
        if (page.getStatusCode() == 0) {
            out.add(Finding.builder(ID, url).issue("fetch-failed").severity(Severity.CRITICAL)
                    .message("No response received")
                    .evidence("error", page.getFetchError())
                    .build());
            return out;
        }
        int status = page.getStatusCode();
        if (page.getFetchError() != null && status >= 300 && status < 400) {
            out.add(Finding.builder(ID, url).issue("malformed-redirect").severity(Severity.WARNING)
                    .message(page.getFetchError())
                    .evidence("status", status)
                    .build());
            return out;
        }
        if (status >= 400) {
            out.add(Finding.builder(ID, url).issue("http-error")
                    .severity(status >= 500 ? Severity.CRITICAL : Severity.WARNING)
                    .message("HTTP " + status)
                    .evidence("status", status)
                    .evidence("finalUrl", page.isRedirected() ? page.getFinalUrl() : null)
                    .build());
        }
        if (page.isBodyTruncated()) {
            out.add(Finding.builder(ID, url).issue("body-truncated").severity(Severity.INFO)
                    .message("Body cut at the size limit; content checks saw a partial page")
                    .evidence("bytes", page.getByteSize())
                    .build());
        }
        if (page.getRedirectChain().size() > redirectHopLimit) {
            out.add(Finding.builder(ID, url).issue("redirect-chain").severity(Severity.WARNING)
                    .message(page.getRedirectChain().size() + " redirects before " + page.getFinalUrl()
                            + " (limit " + redirectHopLimit + ")")
                    .evidence("hops", page.getRedirectChain().size())
                    .evidence("chain", chain(page))
                    .build());
        }
        return out;
    }

    private static String chain(PageModel page) {
        return page.getRedirectChain().stream()
                .map(RedirectHop::url)
                .collect(Collectors.joining(" -> ")) + " -> " + page.getFinalUrl();
    }
}
