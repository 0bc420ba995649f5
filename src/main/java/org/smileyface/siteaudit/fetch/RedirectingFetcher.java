package org.smileyface.siteaudit.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.crawler.NormalizationException;
import org.smileyface.siteaudit.crawler.PolitenessGate;
import org.smileyface.siteaudit.crawler.UrlNormalizer;
import org.smileyface.siteaudit.model.RedirectHop;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Follows redirects hop by hop so the whole chain is recorded.
 * Every hop is a request of its own: robots.txt of the hop's origin is consulted first and a
 * politeness permit is held just for that request. A disallowed hop is not fetched; the chain stops
 * there and the result names the blocked URL.
 * Each Location is normalized against the URL that returned it. A target already seen in the chain
 * ends the fetch as a loop; more than {@code maxRedirects} hops ends it as too many redirects; a
 * Location that cannot be normalized ends it as malformed. I/O errors are captured in the result.
 */
public class RedirectingFetcher {

    private static final Logger log = LoggerFactory.getLogger(RedirectingFetcher.class);

    private final PageFetcher fetcher;
    private final PolitenessGate gate;
    private final UrlNormalizer normalizer;
    private final int maxRedirects;

    public RedirectingFetcher(PageFetcher fetcher, PolitenessGate gate, UrlNormalizer normalizer, int maxRedirects) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must be >= 0");
        this.maxRedirects = maxRedirects;
    }

    public FetchResult fetch(String url) throws InterruptedException {
        long start = System.nanoTime();
        List<RedirectHop> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(url);
        String current = url;
        for (;;) {
            if (!gate.mayFetch(current)) {
                log.debug("Redirect chain from {} stops at {}: disallowed by robots.txt", url, current);
                return blocked(url, current, chain, start);
            }
            FetchResponse res;
            try (PolitenessGate.Permit permit = gate.acquire(current)) {
                res = fetcher.get(current);
            } catch (IOException e) {
                log.debug("Fetch of {} failed: {}", current, e.toString());
                return FetchResult.builder(url)
                        .finalUrl(current)
                        .failure(e)
                        .redirectChain(chain)
                        .latencyMs(elapsedMs(start))
                        .build();
            }

            String location = res.header("Location");
            if (!res.isRedirect() || location == null || location.isBlank()) {
                return FetchResult.builder(url)
                        .finalUrl(current)
                        .response(res)
                        .redirectChain(chain)
                        .latencyMs(elapsedMs(start))
                        .build();
            }

            String target;
            try {
                target = normalizer.normalize(location, current);
            } catch (NormalizationException e) {
                log.debug("Redirect from {} has unusable Location '{}': {}", current, location, e.getMessage());
                chain.add(new RedirectHop(current, res.status(), location));
                return FetchResult.builder(url)
                        .finalUrl(current)
                        .response(res)
                        .redirectChain(chain)
                        .malformedLocation(location)
                        .latencyMs(elapsedMs(start))
                        .build();
            }

            chain.add(new RedirectHop(current, res.status(), target));
            if (!seen.add(target)) {
                log.debug("Redirect loop at {} -> {}", current, target);
                return FetchResult.builder(url)
                        .finalUrl(target)
                        .response(res)
                        .redirectChain(chain)
                        .redirectLoop(true)
                        .latencyMs(elapsedMs(start))
                        .build();
            }
            if (chain.size() > maxRedirects) {
                return FetchResult.builder(url)
                        .finalUrl(target)
                        .response(res)
                        .redirectChain(chain)
                        .tooManyRedirects(true)
                        .latencyMs(elapsedMs(start))
                        .build();
            }
            current = target;
        }
    }

    /**
     * Result for a chain that reached a disallowed URL. The last response received, if any, stays the
     * final one; the blocked hop is recorded but never requested.
     */
    private static FetchResult blocked(String url, String target, List<RedirectHop> chain, long start) {
        FetchResult.Builder b = FetchResult.builder(url).robotsBlockedUrl(target).redirectChain(chain);
        if (!chain.isEmpty()) {
            RedirectHop last = chain.get(chain.size() - 1);
            b.finalUrl(last.url()).statusCode(last.statusCode());
        }
        return b.latencyMs(elapsedMs(start)).build();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
