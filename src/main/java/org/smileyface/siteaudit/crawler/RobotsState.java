package org.smileyface.siteaudit.crawler;

/**
 * Robots.txt lifecycle of one origin. An origin leaves UNKNOWN exactly once.
 */
public enum RobotsState {
    UNKNOWN,
    FETCHING_ROBOTS,

    /** Rules parsed from robots.txt, or allow-all because the file does not exist. */
    RULES_LOADED,

    /** robots.txt could not be retrieved (5xx or network error); crawling continues allow-all. */
    ROBOTS_UNAVAILABLE
}
