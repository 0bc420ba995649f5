package org.smileyface.siteaudit.model;

/**
 * One redirect response in a fetch: the URL requested, the 3xx status it answered with and where it pointed.
 */
public record RedirectHop(String url, int statusCode, String location) {
}
