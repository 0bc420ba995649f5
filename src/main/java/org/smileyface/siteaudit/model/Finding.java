package org.smileyface.siteaudit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One issue reported by a technical check for one URL.
 * The check id names the check that produced it; the issue code names the specific problem
 * (for example check "status-integrity", issue "redirect-chain").
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Finding {

    /** Stable report order: URL, then check id, issue code and message. */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::getUrl)
            .thenComparing(Finding::getCheckId)
            .thenComparing(Finding::getIssue)
            .thenComparing(Finding::getMessage);

    private final String checkId;
    private final String issue;
    private final Severity severity;
    private final String url;
    private final String message;
    private final Map<String, String> evidence;

    private Finding(Builder b) {
        this.checkId = Objects.requireNonNull(b.checkId, "checkId");
        this.issue = b.issue != null ? b.issue : b.checkId;
        this.severity = Objects.requireNonNull(b.severity, "severity");
        this.url = Objects.requireNonNull(b.url, "url");
        this.message = b.message != null ? b.message : "";
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(b.evidence));
    }

    public static Builder builder(String checkId, String url) {
        return new Builder(checkId, url);
    }

    public String getCheckId() { return checkId; }
    public String getIssue() { return issue; }
    public Severity getSeverity() { return severity; }
    public String getUrl() { return url; }
    public String getMessage() { return message; }
    public Map<String, String> getEvidence() { return evidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Finding that = (Finding) o;
        return checkId.equals(that.checkId) && issue.equals(that.issue) && severity == that.severity
                && url.equals(that.url) && message.equals(that.message) && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkId, issue, severity, url, message, evidence);
    }

    @Override
    public String toString() {
        return "Finding{" + severity + " " + checkId + "/" + issue + " url='" + url + "' message='" + message + "'}";
    }

    public static final class Builder {
        private final String checkId;
        private final String url;
        private String issue;
        private Severity severity = Severity.WARNING;
        private String message;
        private final Map<String, String> evidence = new LinkedHashMap<>();

        private Builder(String checkId, String url) {
            this.checkId = checkId;
            this.url = url;
        }

        public Builder issue(String issue) { this.issue = issue; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder message(String message) { this.message = message; return this; }

        /** Adds an evidence entry; null values are skipped. */
        public Builder evidence(String key, Object value) {
            if (key != null && value != null) {
                evidence.put(key, String.valueOf(value));
            }
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }
}
