package org.smileyface.siteaudit.crawler;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.testutil.ScriptedFetcher;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class PolitenessGateTest {

    private static final String ORIGIN = "https://example.com";
    private static final String ROBOTS = ORIGIN + "/robots.txt";

    private static PolitenessGate gate(ScriptedFetcher fetcher, long minDelayMs, long maxDelayMs, int perHost) {
        return new PolitenessGate(fetcher, "siteauditbot", Duration.ofMillis(minDelayMs), Duration.ofMillis(maxDelayMs), perHost);
    }

    @Test
    void robotsDisallow_isHonoured() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher().text(ROBOTS, "User-agent: *\nDisallow: /private\n");
        PolitenessGate gate = gate(fetcher, 0, 1000, 2);

        assertThat(gate.mayFetch(ORIGIN + "/private/page")).isFalse();
        assertThat(gate.mayFetch(ORIGIN + "/public")).isTrue();
        assertThat(gate.robotsState(ORIGIN)).isEqualTo(RobotsState.RULES_LOADED);
        assertThat(fetcher.calls(ROBOTS)).isEqualTo(1);
    }

    @Test
    void specificAgentGroup_winsOverWildcard() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher().text(ROBOTS,
                "User-agent: siteauditbot\nDisallow: /\n\nUser-agent: *\nDisallow:\n");
        PolitenessGate gate = gate(fetcher, 0, 1000, 2);

        assertThat(gate.mayFetch(ORIGIN + "/anything")).isFalse();
    }

    @Test
    void missingRobots_allowsAll() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher().status(ROBOTS, 404);
        PolitenessGate gate = gate(fetcher, 0, 1000, 2);

        assertThat(gate.mayFetch(ORIGIN + "/x")).isTrue();
        assertThat(gate.robotsState(ORIGIN)).isEqualTo(RobotsState.RULES_LOADED);
    }

    @Test
    void serverErrorOrNetworkFailure_degradesToAllowAllWithMinimumDelay() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .status(ROBOTS, 503)
                .fail("https://other.example/robots.txt", new SocketTimeoutException("timed out"));
        PolitenessGate gate = gate(fetcher, 250, 1000, 2);

        assertThat(gate.mayFetch(ORIGIN + "/x")).isTrue();
        assertThat(gate.robotsState(ORIGIN)).isEqualTo(RobotsState.ROBOTS_UNAVAILABLE);
        assertThat(gate.delay(ORIGIN)).isEqualTo(Duration.ofMillis(250));

        assertThat(gate.mayFetch("https://other.example/y")).isTrue();
        assertThat(gate.robotsState("https://other.example")).isEqualTo(RobotsState.ROBOTS_UNAVAILABLE);
    }

    @Test
    void robotsRedirect_isFollowed() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .redirect(ROBOTS, 301, "https://example.com/real-robots.txt")
                .text(ORIGIN + "/real-robots.txt", "User-agent: *\nDisallow: /secret\n");
        PolitenessGate gate = gate(fetcher, 0, 1000, 2);

        assertThat(gate.mayFetch(ORIGIN + "/secret")).isFalse();
    }

    @Test
    void crawlDelay_isClampedBetweenMinimumAndMaximum() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .text(ROBOTS, "User-agent: *\nCrawl-delay: 2\n")
                .text("https://slow.example/robots.txt", "User-agent: *\nCrawl-delay: 60\n");
        PolitenessGate gate = gate(fetcher, 100, 5000, 2);

        gate.mayFetch(ORIGIN + "/");
        gate.mayFetch("https://slow.example/");

        assertThat(gate.delay(ORIGIN)).isEqualTo(Duration.ofSeconds(2));
        assertThat(gate.delay("https://slow.example")).isEqualTo(Duration.ofSeconds(5));
        assertThat(gate.delay("https://unseen.example")).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void concurrentCallers_fetchRobotsOnce() throws Exception {
        AtomicInteger robotsCalls = new AtomicInteger();
        ScriptedFetcher fetcher = new ScriptedFetcher().respond(ROBOTS, (u, n) -> {
            robotsCalls.incrementAndGet();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ScriptedFetcher.response(200, "text/plain", "User-agent: *\nDisallow: /no\n");
        });
        PolitenessGate gate = gate(fetcher, 0, 1000, 4);

        ExecutorService exec = Executors.newFixedThreadPool(6);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                String url = ORIGIN + (i % 2 == 0 ? "/no/" + i : "/yes/" + i);
                results.add(exec.submit(() -> gate.mayFetch(url)));
            }
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get(5, TimeUnit.SECONDS)).isEqualTo(i % 2 != 0);
            }
        } finally {
            exec.shutdownNow();
        }
        assertThat(robotsCalls.get()).isEqualTo(1);
    }

    @Test
    void acquire_spacesRequestStartsByDelay() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher();
        PolitenessGate gate = gate(fetcher, 150, 1000, 4);

        long start = System.nanoTime();
        gate.acquire(ORIGIN + "/a").close();
        gate.acquire(ORIGIN + "/b").close();
        gate.acquire(ORIGIN + "/c").close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(280);
    }

    @Test
    void acquire_blocksAtPerHostCeilingUntilPermitClosed() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher();
        PolitenessGate gate = gate(fetcher, 0, 1000, 1);

        PolitenessGate.Permit first = gate.acquire(ORIGIN + "/a");
        assertThat(first.origin()).isEqualTo(ORIGIN);

        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch acquired = new CountDownLatch(1);
            exec.submit(() -> {
                try (PolitenessGate.Permit second = gate.acquire(ORIGIN + "/b")) {
                    acquired.countDown();
                }
                return null;
            });
            assertThat(acquired.await(300, TimeUnit.MILLISECONDS)).isFalse();
            first.close();
            first.close();
            assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void firstRequest_waitsDelayAfterRobotsFetch() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher().text(ROBOTS, "User-agent: *\nAllow: /\n");
        PolitenessGate gate = gate(fetcher, 300, 1000, 2);

        long start = System.nanoTime();
        gate.acquire(ORIGIN + "/a").close();

        assertThat(fetcher.calls(ROBOTS)).isEqualTo(1);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(290);
    }

    @Test
    void origins_doNotBlockEachOther() throws Exception {
        ScriptedFetcher fetcher = new ScriptedFetcher();
        PolitenessGate gate = gate(fetcher, 1000, 10000, 1);
        gate.mayFetch(ORIGIN + "/");
        gate.mayFetch("https://other.example/");
        Thread.sleep(1100);

        gate.acquire(ORIGIN + "/a").close();
        long start = System.nanoTime();
        gate.acquire("https://other.example/a").close();

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(500);
    }
}
