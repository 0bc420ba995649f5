package org.smileyface.siteaudit.crawler;

/**
 * Point-in-time counters of a frontier.
 *
 * @param queued          tasks waiting to be dequeued
 * @param inFlight        tasks dequeued but not yet marked visited
 * @param visited         URLs with a terminal record
 * @param admitted        URLs ever accepted, the figure compared against the page budget
 * @param refusedByBudget discoveries turned away because the page budget was spent
 * @param abandoned       queued tasks dropped when the deadline passed or the crawl was stopped
 */
public record FrontierStats(int queued, int inFlight, int visited, int admitted,
                            long refusedByBudget, long abandoned) {
}
