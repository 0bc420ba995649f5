package org.smileyface.siteaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Parsed, read-only representation of one fetched URL, the input to every audit check.
 * HTML responses carry the full set of extracted fields; other content types (images, scripts,
 * stylesheets) and failed fetches only carry status, size, headers and timing.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class PageModel {

    public record Heading(int level, String text) {}

    public record Hreflang(String lang, String url) {}

    /** A structured-data block as found in the page, e.g. format "json-ld". */
    public record StructuredDataBlock(String format, String content) {}

    // Identity
    private final String url;
    private final String finalUrl;
    private final int depth;

    // Response
    private final int statusCode;                 // 0 when no response was received
    private final String contentType;
    private final Map<String, String> headers;
    private final long byteSize;
    private final long fetchLatencyMs;
    private final String fetchError;
    private final List<RedirectHop> redirectChain;
    private final boolean redirectLoop;
    private final boolean tooManyRedirects;
    private final String robotsBlockedUrl;        // redirect hop left unfetched because robots.txt disallows it
    private final boolean bodyTruncated;

    // HTML content
    private final boolean html;
    private final String title;
    private final Map<String, String> metaTags;   // lower-cased name/property -> content
    private final List<Heading> headings;
    private final List<String> outboundLinks;
    private final List<String> resourceLinks;
    private final String canonical;
    private final String canonicalRaw;            // as written, set when it could not be normalized
    private final List<Hreflang> hreflangs;
    private final List<StructuredDataBlock> structuredData;
    private final List<String> malformedLinks;
    private final List<String> parseErrors;
    private final String bodyHash;

    private PageModel(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.finalUrl = b.finalUrl != null ? b.finalUrl : b.url;
        this.depth = b.depth;
        this.statusCode = b.statusCode;
        this.contentType = b.contentType;
        Map<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        h.putAll(b.headers);
        this.headers = Collections.unmodifiableMap(h);
        this.byteSize = b.byteSize;
        this.fetchLatencyMs = b.fetchLatencyMs;
        this.fetchError = b.fetchError;
        this.redirectChain = List.copyOf(b.redirectChain);
        this.redirectLoop = b.redirectLoop;
        this.tooManyRedirects = b.tooManyRedirects;
        this.robotsBlockedUrl = b.robotsBlockedUrl;
        this.bodyTruncated = b.bodyTruncated;
        this.html = b.html;
        this.title = b.title;
        this.metaTags = Collections.unmodifiableMap(new LinkedHashMap<>(b.metaTags));
        this.headings = List.copyOf(b.headings);
        this.outboundLinks = List.copyOf(b.outboundLinks);
        this.resourceLinks = List.copyOf(b.resourceLinks);
        this.canonical = b.canonical;
        this.canonicalRaw = b.canonicalRaw;
        this.hreflangs = List.copyOf(b.hreflangs);
        this.structuredData = List.copyOf(b.structuredData);
        this.malformedLinks = List.copyOf(b.malformedLinks);
        this.parseErrors = List.copyOf(b.parseErrors);
        this.bodyHash = b.bodyHash;
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public String getUrl() { return url; }
    public String getFinalUrl() { return finalUrl; }
    public int getDepth() { return depth; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public Map<String, String> getHeaders() { return headers; }
    public long getByteSize() { return byteSize; }
    public long getFetchLatencyMs() { return fetchLatencyMs; }
    public String getFetchError() { return fetchError; }
    public List<RedirectHop> getRedirectChain() { return redirectChain; }
    public boolean isRedirectLoop() { return redirectLoop; }
    public boolean isTooManyRedirects() { return tooManyRedirects; }
    public String getRobotsBlockedUrl() { return robotsBlockedUrl; }
    public boolean isBodyTruncated() { return bodyTruncated; }
    public boolean isHtml() { return html; }
    public String getTitle() { return title; }
    public Map<String, String> getMetaTags() { return metaTags; }
    public List<Heading> getHeadings() { return headings; }
    public List<String> getOutboundLinks() { return outboundLinks; }
    public List<String> getResourceLinks() { return resourceLinks; }
    public String getCanonical() { return canonical; }
    public String getCanonicalRaw() { return canonicalRaw; }
    public List<Hreflang> getHreflangs() { return hreflangs; }
    public List<StructuredDataBlock> getStructuredData() { return structuredData; }
    public List<String> getMalformedLinks() { return malformedLinks; }
    public List<String> getParseErrors() { return parseErrors; }
    public String getBodyHash() { return bodyHash; }

    /** Meta tag content by lower-case name, or null. */
    public String meta(String name) {
        return metaTags.get(name);
    }

    public String header(String name) {
        return headers.get(name);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @JsonIgnore
    public boolean isRedirected() {
        return !redirectChain.isEmpty();
    }

    /** A 2xx HTML page, the subject of content-level checks. */
    @JsonIgnore
    public boolean isAuditableHtml() {
        return html && isSuccess();
    }

    @Override
    public String toString() {
        return "PageModel{" +
                "url='" + url + '\'' +
                ", finalUrl='" + finalUrl + '\'' +
                ", statusCode=" + statusCode +
                ", contentType='" + contentType + '\'' +
                ", html=" + html +
                ", title='" + title + '\'' +
                ", outboundLinks=" + outboundLinks.size() +
                ", resourceLinks=" + resourceLinks.size() +
                ", byteSize=" + byteSize +
                ", fetchLatencyMs=" + fetchLatencyMs +
                '}';
    }

    public static final class Builder {
        private final String url;
        private String finalUrl;
        private int depth;
        private int statusCode;
        private String contentType;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private long byteSize;
        private long fetchLatencyMs;
        private String fetchError;
        private List<RedirectHop> redirectChain = new ArrayList<>();
        private boolean redirectLoop;
        private boolean tooManyRedirects;
        private String robotsBlockedUrl;
        private boolean bodyTruncated;
        private boolean html;
        private String title;
        private final Map<String, String> metaTags = new LinkedHashMap<>();
        private final List<Heading> headings = new ArrayList<>();
        private final Set<String> outboundLinks = new LinkedHashSet<>();
        private final Set<String> resourceLinks = new LinkedHashSet<>();
        private String canonical;
        private String canonicalRaw;
        private final List<Hreflang> hreflangs = new ArrayList<>();
        private final List<StructuredDataBlock> structuredData = new ArrayList<>();
        private final Set<String> malformedLinks = new LinkedHashSet<>();
        private final List<String> parseErrors = new ArrayList<>();
        private String bodyHash;

        private Builder(String url) {
            this.url = url;
        }

        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder depth(int depth) { this.depth = depth; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder headers(Map<String, String> headers) {
            if (headers != null) this.headers.putAll(headers);
            return this;
        }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder byteSize(long byteSize) { this.byteSize = byteSize; return this; }
        public Builder fetchLatencyMs(long fetchLatencyMs) { this.fetchLatencyMs = fetchLatencyMs; return this; }
        public Builder fetchError(String fetchError) { this.fetchError = fetchError; return this; }
        public Builder redirectChain(List<RedirectHop> chain) {
            this.redirectChain = chain != null ? new ArrayList<>(chain) : new ArrayList<>();
            return this;
        }
        public Builder redirectLoop(boolean redirectLoop) { this.redirectLoop = redirectLoop; return this; }
        public Builder tooManyRedirects(boolean tooManyRedirects) { this.tooManyRedirects = tooManyRedirects; return this; }
        public Builder robotsBlockedUrl(String robotsBlockedUrl) { this.robotsBlockedUrl = robotsBlockedUrl; return this; }
        public Builder bodyTruncated(boolean bodyTruncated) { this.bodyTruncated = bodyTruncated; return this; }
        public Builder html(boolean html) { this.html = html; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder metaTag(String name, String content) {
            this.metaTags.putIfAbsent(name, content);
            return this;
        }
        public Builder heading(int level, String text) { this.headings.add(new Heading(level, text)); return this; }
        public Builder outboundLink(String link) {
            outboundLinks.add(link);
            return this;
        }
        public Builder resourceLink(String link) {
            resourceLinks.add(link);
            return this;
        }
        public Builder canonical(String canonical) { this.canonical = canonical; return this; }
        public Builder canonicalRaw(String canonicalRaw) { this.canonicalRaw = canonicalRaw; return this; }
        public Builder hreflang(String lang, String href) { this.hreflangs.add(new Hreflang(lang, href)); return this; }
        public Builder structuredData(String format, String content) {
            this.structuredData.add(new StructuredDataBlock(format, content));
            return this;
        }
        public Builder malformedLink(String raw) {
            malformedLinks.add(raw);
            return this;
        }
        public Builder parseError(String error) { this.parseErrors.add(error); return this; }
        public Builder bodyHash(String bodyHash) { this.bodyHash = bodyHash; return this; }

        public PageModel build() {
            return new PageModel(this);
        }
    }
}
