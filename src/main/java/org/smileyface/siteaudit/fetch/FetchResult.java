package org.smileyface.siteaudit.fetch;

import org.smileyface.siteaudit.model.RedirectHop;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Outcome of fetching one URL including any redirect hops: either the final response or the error that
 * ended the attempt. Immutable; produced once per crawl task and handed to the page model builder.
 */
public final class FetchResult {

    private final String requestedUrl;
    private final String finalUrl;
    private final int statusCode;               // 0 when no response was received
    private final long latencyMs;
    private final Map<String, String> headers;
    private final String contentType;
    private final byte[] body;
    private final IOException failure;
    private final List<RedirectHop> redirectChain;
    private final boolean redirectLoop;
    private final boolean tooManyRedirects;
    private final String malformedLocation;     // raw Location value that could not be followed
    private final String robotsBlockedUrl;      // hop not fetched because robots.txt disallows it
    private final boolean bodyTruncated;
    private final int attempts;

    private FetchResult(Builder b) {
        this.requestedUrl = Objects.requireNonNull(b.requestedUrl, "requestedUrl");
        this.finalUrl = b.finalUrl != null ? b.finalUrl : b.requestedUrl;
        this.statusCode = b.statusCode;
        this.latencyMs = b.latencyMs;
        Map<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        h.putAll(b.headers);
        this.headers = Collections.unmodifiableMap(h);
        this.contentType = b.contentType;
        this.body = b.body;
        this.failure = b.failure;
        this.redirectChain = List.copyOf(b.redirectChain);
        this.redirectLoop = b.redirectLoop;
        this.tooManyRedirects = b.tooManyRedirects;
        this.malformedLocation = b.malformedLocation;
        this.robotsBlockedUrl = b.robotsBlockedUrl;
        this.bodyTruncated = b.bodyTruncated;
        this.attempts = b.attempts;
    }

    public static Builder builder(String requestedUrl) {
        return new Builder(requestedUrl);
    }

    /** Copy of this result with the attempt count replaced. */
    public FetchResult withAttempts(int attempts) {
        return toBuilder().attempts(attempts).build();
    }

    public Builder toBuilder() {
        return new Builder(requestedUrl)
                .finalUrl(finalUrl)
                .statusCode(statusCode)
                .latencyMs(latencyMs)
                .headers(headers)
                .contentType(contentType)
                .body(body)
                .failure(failure)
                .redirectChain(redirectChain)
                .redirectLoop(redirectLoop)
                .tooManyRedirects(tooManyRedirects)
                .malformedLocation(malformedLocation)
                .robotsBlockedUrl(robotsBlockedUrl)
                .bodyTruncated(bodyTruncated)
                .attempts(attempts);
    }

    public String getRequestedUrl() { return requestedUrl; }
    public String getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public long getLatencyMs() { return latencyMs; }
    public Map<String, String> getHeaders() { return headers; }
    public String getContentType() { return contentType; }
    public IOException getFailure() { return failure; }
    public List<RedirectHop> getRedirectChain() { return redirectChain; }
    public boolean isRedirectLoop() { return redirectLoop; }
    public boolean isTooManyRedirects() { return tooManyRedirects; }
    public String getMalformedLocation() { return malformedLocation; }
    public String getRobotsBlockedUrl() { return robotsBlockedUrl; }
    public boolean isBodyTruncated() { return bodyTruncated; }
    public int getAttempts() { return attempts; }

    /** Response body of the final hop, null when none was received. */
    public byte[] getBody() {
        return body;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public boolean hasResponse() {
        return failure == null && statusCode > 0;
    }

    /** True when the chain stopped before a hop that robots.txt disallows. */
    public boolean isRobotsBlocked() {
        return robotsBlockedUrl != null;
    }

    /** True when the redirect chain could not be completed. */
    public boolean isRedirectFailure() {
        return redirectLoop || tooManyRedirects || malformedLocation != null;
    }

    /** Human-readable reason the fetch did not complete, or null. */
    public String errorMessage() {
        if (failure != null) {
            String msg = failure.getMessage();
            return failure.getClass().getSimpleName() + (msg != null ? ": " + msg : "");
        }
        if (redirectLoop) return "Redirect loop";
        if (tooManyRedirects) return "Too many redirects";
        if (malformedLocation != null) return "Malformed redirect location: " + malformedLocation;
        return null;
    }

    @Override
    public String toString() {
        return "FetchResult{" +
                "requestedUrl='" + requestedUrl + '\'' +
                ", finalUrl='" + finalUrl + '\'' +
                ", statusCode=" + statusCode +
                ", latencyMs=" + latencyMs +
                ", hops=" + redirectChain.size() +
                ", attempts=" + attempts +
                (errorMessage() != null ? ", error='" + errorMessage() + '\'' : "") +
                '}';
    }

    public static final class Builder {
        private final String requestedUrl;
        private String finalUrl;
        private int statusCode;
        private long latencyMs;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String contentType;
        private byte[] body;
        private IOException failure;
        private List<RedirectHop> redirectChain = List.of();
        private boolean redirectLoop;
        private boolean tooManyRedirects;
        private String malformedLocation;
        private String robotsBlockedUrl;
        private boolean bodyTruncated;
        private int attempts = 1;

        private Builder(String requestedUrl) {
            this.requestedUrl = requestedUrl;
        }

        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder latencyMs(long latencyMs) { this.latencyMs = latencyMs; return this; }
        public Builder headers(Map<String, String> headers) {
            if (headers != null) this.headers.putAll(headers);
            return this;
        }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder failure(IOException failure) { this.failure = failure; return this; }
        public Builder redirectChain(List<RedirectHop> redirectChain) {
            this.redirectChain = redirectChain != null ? redirectChain : List.of();
            return this;
        }
        public Builder redirectLoop(boolean redirectLoop) { this.redirectLoop = redirectLoop; return this; }
        public Builder tooManyRedirects(boolean tooManyRedirects) { this.tooManyRedirects = tooManyRedirects; return this; }
        public Builder malformedLocation(String malformedLocation) { this.malformedLocation = malformedLocation; return this; }
        public Builder robotsBlockedUrl(String robotsBlockedUrl) { this.robotsBlockedUrl = robotsBlockedUrl; return this; }
        public Builder bodyTruncated(boolean bodyTruncated) { this.bodyTruncated = bodyTruncated; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }

        /** Copies status, headers, content type and body of the final response. */
        public Builder response(FetchResponse res) {
            return statusCode(res.status()).headers(res.headers()).contentType(res.contentType()).body(res.body())
                    .bodyTruncated(res.truncated());
        }

        public FetchResult build() {
            return new FetchResult(this);
        }
    }
}
