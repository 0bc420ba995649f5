package org.smileyface.siteaudit.crawler;

/**
 * Raised when a raw link cannot be turned into a crawlable absolute URL.
 */
public class NormalizationException extends Exception {

    public enum Reason {
        /** Not parseable as a URI, or missing scheme/host. */
        MALFORMED,

        /** Parseable, but the scheme is not http or https. */
        UNSUPPORTED_SCHEME
    }

    private final String rawUrl;
    private final Reason reason;

    public NormalizationException(String rawUrl, Reason reason, String message) {
        super(message);
        this.rawUrl = rawUrl;
        this.reason = reason;
    }

    public NormalizationException(String rawUrl, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.rawUrl = rawUrl;
        this.reason = reason;
    }

    public String getRawUrl() {
        return rawUrl;
    }

    public Reason getReason() {
        return reason;
    }
}
