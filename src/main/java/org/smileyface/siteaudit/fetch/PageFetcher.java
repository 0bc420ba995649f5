package org.smileyface.siteaudit.fetch;

import java.io.IOException;

/**
 * Performs one HTTP GET without following redirects.
 * HTTP error statuses are returned as responses, never thrown.
 */
@FunctionalInterface
public interface PageFetcher {

    FetchResponse get(String url) throws IOException;
}
