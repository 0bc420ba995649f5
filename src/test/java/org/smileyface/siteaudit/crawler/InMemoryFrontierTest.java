package org.smileyface.siteaudit.crawler;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.OutcomeKind;
import org.smileyface.siteaudit.model.TerminationReason;
import org.smileyface.siteaudit.model.UrlRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryFrontierTest {

    private static UrlRecord fetched(CrawlTask t) {
        return new UrlRecord(t.url(), t.url(), 200, OutcomeKind.FETCHED, t.depth(), t.parent(), 1, null);
    }

    @Test
    void enqueue_deduplicatesAndKeepsFifoOrder() {
        InMemoryFrontier f = new InMemoryFrontier(3, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");

        assertThat(f.enqueue(seed)).isTrue();
        assertThat(f.enqueue(seed.child("https://example.com/a"))).isTrue();
        assertThat(f.enqueue(seed.child("https://example.com/b"))).isTrue();
        assertThat(f.enqueue(seed.child("https://example.com/a"))).isFalse();

        assertThat(f.dequeue()).map(CrawlTask::url).contains("https://example.com/");
        assertThat(f.dequeue()).map(CrawlTask::url).contains("https://example.com/a");
        assertThat(f.dequeue()).map(CrawlTask::url).contains("https://example.com/b");
        assertThat(f.dequeue()).isEmpty();
    }

    @Test
    void enqueue_afterVisit_isStillRefused() {
        InMemoryFrontier f = new InMemoryFrontier(3, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        f.enqueue(seed);
        f.dequeue();
        f.markVisited(seed.url(), fetched(seed));

        assertThat(f.enqueue(CrawlTask.seed("https://example.com/"))).isFalse();
        assertThat(f.inventory()).hasSize(1);
    }

    @Test
    void enqueue_beyondMaxDepth_isRefusedWithoutCountingAgainstBudget() {
        InMemoryFrontier f = new InMemoryFrontier(1, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        CrawlTask a = seed.child("https://example.com/a");
        f.enqueue(seed);
        f.enqueue(a);

        assertThat(f.enqueue(a.child("https://example.com/a/deep"))).isFalse();
        assertThat(f.stats().admitted()).isEqualTo(2);
        assertThat(f.stats().refusedByBudget()).isZero();
    }

    @Test
    void maxPages_capsAdmissionsAndSetsTerminationReason() {
        InMemoryFrontier f = new InMemoryFrontier(5, 2);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        assertThat(f.enqueue(seed)).isTrue();
        assertThat(f.enqueue(seed.child("https://example.com/1"))).isTrue();
        assertThat(f.enqueue(seed.child("https://example.com/2"))).isFalse();
        assertThat(f.enqueue(seed.child("https://example.com/3"))).isFalse();

        drain(f);

        assertThat(f.inventory()).hasSize(2);
        assertThat(f.stats().refusedByBudget()).isEqualTo(2);
        assertThat(f.terminationReason()).isEqualTo(TerminationReason.MAX_PAGES);
    }

    @Test
    void drained_onlyWhenQueueEmptyAndNothingInFlight() {
        InMemoryFrontier f = new InMemoryFrontier(3, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        assertThat(f.isDrained()).isTrue();
        f.enqueue(seed);
        assertThat(f.isDrained()).isFalse();
        f.dequeue();
        assertThat(f.isDrained()).isFalse();
        assertThat(f.stats().inFlight()).isEqualTo(1);
        f.markVisited(seed.url(), fetched(seed));
        assertThat(f.isDrained()).isTrue();
        assertThat(f.terminationReason()).isEqualTo(TerminationReason.DRAINED);
    }

    @Test
    void markVisited_secondRecordIsIgnored() {
        InMemoryFrontier f = new InMemoryFrontier(3, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        f.enqueue(seed);
        f.dequeue();
        f.markVisited(seed.url(), fetched(seed));
        f.markVisited(seed.url(), new UrlRecord(seed.url(), null, null, OutcomeKind.FAILED, 0, null, 1, "late"));
        f.markVisited("https://example.com/never", fetched(CrawlTask.seed("https://example.com/never")));

        assertThat(f.inventory()).singleElement()
                .extracting(UrlRecord::getOutcome).isEqualTo(OutcomeKind.FETCHED);
    }

    @Test
    void deadline_abandonsQueueAndRefusesNewWork() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        InMemoryFrontier f = new InMemoryFrontier(3, 100, clock.instant().plusSeconds(10), clock);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        f.enqueue(seed);
        f.enqueue(seed.child("https://example.com/a"));
        f.enqueue(seed.child("https://example.com/b"));
        Optional<CrawlTask> first = f.dequeue();

        clock.advance(Duration.ofSeconds(11));

        assertThat(f.dequeue()).isEmpty();
        assertThat(f.enqueue(seed.child("https://example.com/c"))).isFalse();
        assertThat(f.isDrained()).isFalse();
        f.markVisited(first.get().url(), fetched(first.get()));
        assertThat(f.isDrained()).isTrue();
        assertThat(f.stats().abandoned()).isEqualTo(2);
        assertThat(f.terminationReason()).isEqualTo(TerminationReason.DEADLINE);
    }

    @Test
    void stop_abandonsQueuedWork() {
        InMemoryFrontier f = new InMemoryFrontier(3, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        f.enqueue(seed);
        f.enqueue(seed.child("https://example.com/a"));

        f.stop();

        assertThat(f.dequeue()).isEmpty();
        assertThat(f.isDrained()).isTrue();
        assertThat(f.stats().abandoned()).isEqualTo(2);
        assertThat(f.terminationReason()).isEqualTo(TerminationReason.STOPPED);
    }

    @Test
    void awaitWork_wakesUpOnEnqueue() throws Exception {
        InMemoryFrontier f = new InMemoryFrontier(3, 100);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        f.enqueue(seed);
        f.dequeue();

        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch started = new CountDownLatch(1);
            var result = exec.submit(() -> {
                started.countDown();
                return f.awaitWork(Duration.ofSeconds(5));
            });
            started.await();
            f.enqueue(seed.child("https://example.com/a"));
            assertThat(result.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void concurrentEnqueue_admitsEachUrlOnce() throws Exception {
        InMemoryFrontier f = new InMemoryFrontier(3, 10_000);
        CrawlTask seed = CrawlTask.seed("https://example.com/");
        List<Boolean> results = Collections.synchronizedList(new ArrayList<>());
        ExecutorService exec = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch go = new CountDownLatch(1);
            for (int t = 0; t < 8; t++) {
                exec.submit(() -> {
                    go.await();
                    for (int i = 0; i < 200; i++) {
                        results.add(f.enqueue(seed.child("https://example.com/p" + i)));
                    }
                    return null;
                });
            }
            go.countDown();
            exec.shutdown();
            assertThat(exec.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            exec.shutdownNow();
        }
        assertThat(results.stream().filter(Boolean::booleanValue).count()).isEqualTo(200);
        assertThat(f.stats().queued()).isEqualTo(200);
    }

    private static void drain(InMemoryFrontier f) {
        Optional<CrawlTask> next;
        while ((next = f.dequeue()).isPresent()) {
            f.markVisited(next.get().url(), fetched(next.get()));
        }
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
