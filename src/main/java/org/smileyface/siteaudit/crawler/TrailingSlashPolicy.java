package org.smileyface.siteaudit.crawler;

/**
 * How a trailing slash on a non-root path is treated during normalization.
 */
public enum TrailingSlashPolicy {
    /** Leave the path as found. */
    PRESERVE,

    /** Remove a trailing slash, "/docs/" becomes "/docs". */
    STRIP,

    /** Add a trailing slash to paths whose last segment has no file extension. */
    ADD
}
