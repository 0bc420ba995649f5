package org.smileyface.siteaudit.fetch;

import org.smileyface.siteaudit.crawler.CrawlConfig;

/**
 * Creates the fetcher a crawl session uses, configured from that session's settings.
 */
@FunctionalInterface
public interface PageFetcherFactory {

    PageFetcher create(CrawlConfig config);
}
