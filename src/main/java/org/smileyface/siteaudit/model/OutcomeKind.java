package org.smileyface.siteaudit.model;

/**
 * Terminal disposition of a URL in a crawl.
 */
public enum OutcomeKind {
    /** A response was received (any status that is not a retry-exhausted 5xx/429). */
    FETCHED,

    /** No usable response: network error, retries exhausted, redirect loop or too many redirects. */
    FAILED,

    /** Never fetched because robots.txt disallows it. */
    SKIPPED_ROBOTS,

    /** The fetch ended on a redirect whose target could not be normalized. */
    MALFORMED
}
