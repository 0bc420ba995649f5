package org.smileyface.siteaudit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Inventory entry for one visited URL: its terminal outcome plus where and how deep it was found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class UrlRecord {

    private final String url;
    private final String finalUrl;      // after redirects, null when nothing was fetched
    private final Integer statusCode;   // last HTTP status, null when no response
    private final OutcomeKind outcome;
    private final int depth;
    private final String parent;        // discovering page, null for the seed
    private final int attempts;
    private final String error;

    public UrlRecord(String url, String finalUrl, Integer statusCode, OutcomeKind outcome,
                     int depth, String parent, int attempts, String error) {
        this.url = Objects.requireNonNull(url, "url");
        this.finalUrl = finalUrl;
        this.statusCode = statusCode;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.depth = depth;
        this.parent = parent;
        this.attempts = attempts;
        this.error = error;
    }

    public static UrlRecord skippedByRobots(String url, int depth, String parent) {
        return new UrlRecord(url, null, null, OutcomeKind.SKIPPED_ROBOTS, depth, parent, 0, null);
    }

    public String getUrl() { return url; }
    public String getFinalUrl() { return finalUrl; }
    public Integer getStatusCode() { return statusCode; }
    public OutcomeKind getOutcome() { return outcome; }
    public int getDepth() { return depth; }
    public String getParent() { return parent; }
    public int getAttempts() { return attempts; }
    public String getError() { return error; }

    /** True for outcomes a link checker should report: failures and 4xx responses. */
    public boolean isBroken() {
        if (outcome == OutcomeKind.FAILED) return true;
        return outcome == OutcomeKind.FETCHED && statusCode != null && statusCode >= 400 && statusCode < 500;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UrlRecord that = (UrlRecord) o;
        return depth == that.depth && attempts == that.attempts
                && url.equals(that.url)
                && Objects.equals(finalUrl, that.finalUrl)
                && Objects.equals(statusCode, that.statusCode)
                && outcome == that.outcome
                && Objects.equals(parent, that.parent)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, finalUrl, statusCode, outcome, depth, parent, attempts, error);
    }

    @Override
    public String toString() {
        return "UrlRecord{" +
                "url='" + url + '\'' +
                ", finalUrl='" + finalUrl + '\'' +
                ", statusCode=" + statusCode +
                ", outcome=" + outcome +
                ", depth=" + depth +
                ", parent='" + parent + '\'' +
                ", attempts=" + attempts +
                '}';
    }
}
