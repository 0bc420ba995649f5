package org.smileyface.siteaudit.testutil;

import org.smileyface.siteaudit.fetch.FetchResponse;
import org.smileyface.siteaudit.fetch.PageFetcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link PageFetcher} serving canned responses by exact URL. Unknown URLs answer 404.
 * Every call is recorded so tests can count requests per URL.
 */
public class ScriptedFetcher implements PageFetcher {

    public interface Responder {
        FetchResponse respond(String url, int call) throws IOException;
    }

    private final Map<String, Responder> routes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<String> requested = Collections.synchronizedList(new ArrayList<>());

    public ScriptedFetcher html(String url, String body) {
        return respond(url, (u, n) -> response(200, "text/html; charset=UTF-8", body));
    }

    public ScriptedFetcher text(String url, String body) {
        return respond(url, (u, n) -> response(200, "text/plain", body));
    }

    public ScriptedFetcher status(String url, int status) {
        return respond(url, (u, n) -> response(status, "text/html", ""));
    }

    public ScriptedFetcher redirect(String url, int status, String location) {
        return respond(url, (u, n) -> new FetchResponse(status, Map.of("Location", location), null, new byte[0]));
    }

    public ScriptedFetcher fail(String url, IOException e) {
        return respond(url, (u, n) -> {
            throw e;
        });
    }

    public ScriptedFetcher respond(String url, Responder responder) {
        routes.put(url, responder);
        return this;
    }

    @Override
    public FetchResponse get(String url) throws IOException {
        requested.add(url);
        int n = calls.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        Responder r = routes.get(url);
        if (r == null) {
            return response(404, "text/html", "not found");
        }
        return r.respond(url, n);
    }

    public int calls(String url) {
        AtomicInteger n = calls.get(url);
        return n == null ? 0 : n.get();
    }

    public List<String> requested() {
        synchronized (requested) {
            return new ArrayList<>(requested);
        }
    }

    public static FetchResponse response(int status, String contentType, String body) {
        return new FetchResponse(status, Map.of("Content-Type", contentType), contentType,
                body.getBytes(StandardCharsets.UTF_8));
    }
}
