package org.smileyface.siteaudit.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link PageFetcher} backed by the jsoup HTTP client. Redirects are not followed so the caller can
 * record every hop; error statuses and non-HTML content types are returned as regular responses.
 * Bodies longer than the size limit are cut and flagged as truncated.
 */
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final String userAgent;
    private final int timeoutMs;
    private final int maxBodySizeBytes;

    public JsoupPageFetcher(String userAgent, Duration timeout, int maxBodySizeBytes) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(0, timeout.toMillis()));
        this.maxBodySizeBytes = Math.max(0, maxBodySizeBytes);
    }

    /**
     * jsoup stops reading silently at the size limit. A body that fills the limit counts as cut unless
     * the declared Content-Length says it was complete.
     */
    boolean isTruncated(int bodyLength, String contentLength) {
        if (maxBodySizeBytes == 0 || bodyLength < maxBodySizeBytes) {
            return false;
        }
        if (contentLength != null) {
            try {
                return Long.parseLong(contentLength.trim()) > bodyLength;
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparseable Content-Length '{}'", contentLength);
            }
        }
        return true;
    }

    @Override
    public FetchResponse get(String url) throws IOException {
        Connection conn;
        try {
            conn = Jsoup.connect(url);
        } catch (IllegalArgumentException e) {
            MalformedURLException mue = new MalformedURLException(e.getMessage());
            mue.initCause(e);
            throw mue;
        }
        Connection.Response res = conn
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .maxBodySize(maxBodySizeBytes)
                .followRedirects(false)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .method(Connection.Method.GET)
                .execute();
        byte[] body = res.bodyAsBytes();
        return new FetchResponse(res.statusCode(), res.headers(), res.contentType(), body,
                isTruncated(body.length, res.header("Content-Length")));
    }
}
