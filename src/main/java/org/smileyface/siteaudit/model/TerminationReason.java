package org.smileyface.siteaudit.model;

/**
 * Why a crawl session stopped admitting work.
 */
public enum TerminationReason {
    /** Every reachable in-scope URL within the depth budget was visited. */
    DRAINED,

    /** The page budget refused at least one discovered URL. */
    MAX_PAGES,

    /** The wall-clock time limit passed; queued URLs were abandoned. */
    DEADLINE,

    /** The session was stopped from outside. */
    STOPPED
}
