package org.smileyface.siteaudit.crawler;

import java.util.Objects;

/**
 * A unit of crawl work: one normalized URL, the depth it was found at and the page that linked to it.
 * The seed task has depth 0 and no parent.
 */
public record CrawlTask(String url, int depth, String parent) {

    public CrawlTask {
        Objects.requireNonNull(url, "url");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
    }

    public static CrawlTask seed(String url) {
        return new CrawlTask(url, 0, null);
    }

    /** Task for a link discovered on this task's page, one level deeper. */
    public CrawlTask child(String childUrl) {
        return new CrawlTask(childUrl, depth + 1, url);
    }
}
