package org.smileyface.siteaudit.crawler;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.siteaudit.fetch.FetchResponse;
import org.smileyface.siteaudit.fetch.PageFetcher;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-origin admission control: robots.txt rules, crawl delay and a per-host concurrency ceiling.
 * <p>
 * robots.txt is fetched once per origin by the first caller; concurrent callers for the same origin
 * wait for that load instead of fetching again. The fetch happens outside the host lock and delays the
 * first page request like any other request to the origin. A missing
 * file (4xx) means allow-all; a server error or network failure also means allow-all, with the
 * global minimum delay, and is logged as degraded. Origins never contend with each other.
 */
public class PolitenessGate {

    private static final Logger log = LogManager.getLogger();

    static final int MAX_ROBOTS_REDIRECTS = 5;

    private final PageFetcher fetcher;
    private final String robotToken;
    private final Duration minDelay;
    private final Duration maxDelay;
    private final int perHostConcurrency;
    private final UrlNormalizer redirectNormalizer = UrlNormalizer.lenient();
    private final ConcurrentMap<String, HostState> hosts = new ConcurrentHashMap<>();

    public PolitenessGate(PageFetcher fetcher, String robotToken, Duration minDelay, Duration maxDelay,
                          int perHostConcurrency) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.robotToken = Objects.requireNonNull(robotToken, "robotToken");
        this.minDelay = Objects.requireNonNull(minDelay, "minDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (perHostConcurrency < 1) throw new IllegalArgumentException("perHostConcurrency must be >= 1");
        this.perHostConcurrency = perHostConcurrency;
    }

    public static PolitenessGate forConfig(PageFetcher fetcher, CrawlConfig config) {
        return new PolitenessGate(fetcher, config.robotToken(), config.minCrawlDelay(), config.maxCrawlDelay(),
                config.perHostConcurrency());
    }

    /**
     * True when robots.txt of the URL's origin allows our robot token to fetch it.
     * Loads the origin's rules on first use.
     */
    public boolean mayFetch(String url) throws InterruptedException {
        HostState h = hostFor(url);
        return ensureRobots(h).isAllowed(url);
    }

    /**
     * Effective spacing between request starts on the origin: the robots crawl-delay capped at the
     * configured maximum, never below the configured minimum. The minimum until robots is loaded.
     */
    public Duration delay(String origin) {
        HostState h = hosts.get(origin);
        if (h == null) return minDelay;
        h.lock.lock();
        try {
            return h.delay != null ? h.delay : minDelay;
        } finally {
            h.lock.unlock();
        }
    }

    public RobotsState robotsState(String origin) {
        HostState h = hosts.get(origin);
        if (h == null) return RobotsState.UNKNOWN;
        h.lock.lock();
        try {
            return h.robotsState;
        } finally {
            h.lock.unlock();
        }
    }

    /**
     * Blocks until a request to the URL's origin may start: fewer than the per-host ceiling in flight
     * and at least {@link #delay(String)} since the previous start, the robots.txt fetch included.
     * One permit covers one request; the caller closes it once the response is in.
     */
    public Permit acquire(String url) throws InterruptedException {
        HostState h = hostFor(url);
        ensureRobots(h);
        h.lock.lock();
        try {
            long delayNanos = h.delay.toNanos();
            for (;;) {
                if (h.inFlight >= perHostConcurrency) {
                    h.changed.await();
                    continue;
                }
                if (!h.started) {
                    break;
                }
                long wait = h.lastStartNanos + delayNanos - System.nanoTime();
                if (wait <= 0) {
                    break;
                }
                h.changed.awaitNanos(wait);
            }
            h.inFlight++;
            h.started = true;
            h.lastStartNanos = System.nanoTime();
            h.fetchesStarted++;
            return new Permit(h);
        } finally {
            h.lock.unlock();
        }
    }

    private HostState hostFor(String url) {
        String origin = UrlNormalizer.originOf(url);
        return hosts.computeIfAbsent(origin, HostState::new);
    }

    private BaseRobotRules ensureRobots(HostState h) throws InterruptedException {
        h.lock.lock();
        try {
            while (h.robotsState == RobotsState.FETCHING_ROBOTS) {
                h.changed.await();
            }
            if (h.robotsState != RobotsState.UNKNOWN) {
                return h.rules;
            }
            h.robotsState = RobotsState.FETCHING_ROBOTS;
        } finally {
            h.lock.unlock();
        }

        RobotsLoad load = null;
        try {
            load = loadRobots(h.origin);
        } finally {
            h.lock.lock();
            try {
                if (load == null) {
                    // loader died with an unchecked exception; do not leave waiters blocked
                    load = new RobotsLoad(allowAll(), RobotsState.ROBOTS_UNAVAILABLE);
                }
                h.rules = load.rules();
                h.robotsState = load.state();
                h.delay = effectiveDelay(load.rules());
                // the robots.txt request counts as a start on this origin
                h.started = true;
                h.lastStartNanos = System.nanoTime();
                h.changed.signalAll();
            } finally {
                h.lock.unlock();
            }
        }
        return load.rules();
    }

    private RobotsLoad loadRobots(String origin) {
        String current = origin + "/robots.txt";
        for (int hop = 0; ; hop++) {
            FetchResponse res;
            try {
                res = fetcher.get(current);
            } catch (IOException e) {
                log.warn("robots.txt for {} unavailable ({}); degraded mode: allow-all with {} ms delay",
                        origin, e.toString(), minDelay.toMillis());
                return new RobotsLoad(allowAll(), RobotsState.ROBOTS_UNAVAILABLE);
            }
            int status = res.status();
            String location = res.header("Location");
            if (res.isRedirect() && location != null && !location.isBlank()) {
                if (hop >= MAX_ROBOTS_REDIRECTS) {
                    log.info("robots.txt for {} redirects more than {} times; treating as absent",
                            origin, MAX_ROBOTS_REDIRECTS);
                    return new RobotsLoad(allowAll(), RobotsState.RULES_LOADED);
                }
                try {
                    current = redirectNormalizer.normalize(location, current);
                } catch (NormalizationException e) {
                    log.info("robots.txt for {} redirects to unusable '{}'; treating as absent", origin, location);
                    return new RobotsLoad(allowAll(), RobotsState.RULES_LOADED);
                }
                continue;
            }
            if (status >= 200 && status < 300) {
                SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
                BaseRobotRules rules = parser.parseContent(current, res.body(),
                        res.contentType() != null ? res.contentType() : "text/plain", List.of(robotToken));
                log.info("robots.txt for {} loaded ({} bytes, crawl-delay={})", origin, res.body().length,
                        rules.getCrawlDelay() == BaseRobotRules.UNSET_CRAWL_DELAY ? "unset" : rules.getCrawlDelay() + " ms");
                return new RobotsLoad(rules, RobotsState.RULES_LOADED);
            }
            if (status >= 500) {
                log.warn("robots.txt for {} returned HTTP {}; degraded mode: allow-all with {} ms delay",
                        origin, status, minDelay.toMillis());
                return new RobotsLoad(allowAll(), RobotsState.ROBOTS_UNAVAILABLE);
            }
            log.info("robots.txt for {} absent (HTTP {}); allow-all", origin, status);
            return new RobotsLoad(allowAll(), RobotsState.RULES_LOADED);
        }
    }

    private Duration effectiveDelay(BaseRobotRules rules) {
        long robotsMs = rules.getCrawlDelay();
        if (robotsMs == BaseRobotRules.UNSET_CRAWL_DELAY || robotsMs <= 0) {
            return minDelay;
        }
        Duration robots = Duration.ofMillis(robotsMs);
        if (robots.compareTo(maxDelay) > 0) robots = maxDelay;
        return robots.compareTo(minDelay) < 0 ? minDelay : robots;
    }

    private static BaseRobotRules allowAll() {
        return new SimpleRobotRules(SimpleRobotRules.RobotRulesMode.ALLOW_ALL);
    }

    private record RobotsLoad(BaseRobotRules rules, RobotsState state) {}

    /**
     * Admission to fetch from one origin. Closing it frees the in-flight slot; closing twice is harmless.
     */
    public static final class Permit implements AutoCloseable {
        private final HostState host;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Permit(HostState host) {
            this.host = host;
        }

        public String origin() {
            return host.origin;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            host.lock.lock();
            try {
                host.inFlight--;
                host.changed.signalAll();
            } finally {
                host.lock.unlock();
            }
        }
    }
}
