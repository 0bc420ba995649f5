package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;

import java.util.List;

/**
 * A technical check run against one page after the crawl has drained.
 * The index gives read-only access to every other page and URL outcome of the session.
 */
@FunctionalInterface
public interface AuditCheck {

    /**
     * @param page  the page under audit
     * @param index the finished crawl
     * @return findings for this page, never null
     */
    List<Finding> check(PageModel page, CrawlIndex index);
}
