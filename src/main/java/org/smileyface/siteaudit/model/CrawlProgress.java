package org.smileyface.siteaudit.model;

import java.time.Instant;

/**
 * Point-in-time view of a running audit.
 */
public record CrawlProgress(String seedUrl,
                            Instant startedAt,
                            Phase phase,
                            int queued,
                            int inFlight,
                            int visited,
                            int admitted,
                            int workers) {

    public enum Phase {
        CRAWLING,
        CHECKING,
        DONE
    }
}
