package org.smileyface.siteaudit.fetch;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One raw HTTP exchange. Header lookup is case-insensitive.
 *
 * @param truncated the body was cut at the fetcher's size limit
 */
public record FetchResponse(int status, Map<String, String> headers, String contentType, byte[] body,
                            boolean truncated) {

    public FetchResponse {
        Map<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) h.putAll(headers);
        headers = Collections.unmodifiableMap(h);
        if (contentType == null) contentType = h.get("Content-Type");
        body = body == null ? new byte[0] : body;
    }

    public FetchResponse(int status, Map<String, String> headers, String contentType, byte[] body) {
        this(status, headers, contentType, body, false);
    }

    public String header(String name) {
        return headers.get(name);
    }

    public boolean isRedirect() {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }
}
