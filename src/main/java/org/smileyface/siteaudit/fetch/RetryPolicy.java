package org.smileyface.siteaudit.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.crawler.CrawlConfig;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Retries transient fetch failures with capped exponential backoff.
 * <p>
 * Retried: I/O errors other than unknown host, TLS and malformed URL failures, 5xx responses and 429.
 * A 429 honours {@code Retry-After} given as seconds or an HTTP date, capped at the maximum backoff.
 * Everything else, including other 4xx and broken redirect chains, is returned as is.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,9}");

    /**
     * A single fetch attempt. Implementations acquire their own politeness permit.
     */
    @FunctionalInterface
    public interface Attempt {
        FetchResult execute() throws InterruptedException;
    }

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        Sleeper THREAD = d -> Thread.sleep(d.toMillis());
    }

    private final int maxRetries;
    private final Duration backoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryPolicy(int maxRetries, Duration backoff, Duration maxBackoff, Sleeper sleeper, Clock clock) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public static RetryPolicy forConfig(CrawlConfig config) {
        return new RetryPolicy(config.maxRetries(), config.retryBackoff(), config.retryBackoffMax(),
                Sleeper.THREAD, Clock.systemUTC());
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Runs the attempt until it succeeds, fails permanently or the retry budget is spent.
     * The returned result carries the number of attempts made.
     */
    public FetchResult execute(String url, Attempt attempt) throws InterruptedException {
        int n = 1;
        for (;;) {
            FetchResult result = attempt.execute();
            if (n > maxRetries || !isRetryable(result)) {
                return result.withAttempts(n);
            }
            Duration wait = delayBefore(n + 1, result);
            log.debug("Attempt {}/{} for {} gave {}; retrying in {} ms",
                    n, maxRetries + 1, url, describe(result), wait.toMillis());
            sleeper.sleep(wait);
            n++;
        }
    }

    public boolean isRetryable(FetchResult result) {
        if (result.getFailure() != null) {
            return isRetryable(result.getFailure());
        }
        if (result.isRedirectFailure()) {
            return false;
        }
        int status = result.getStatusCode();
        return status >= 500 || status == 429;
    }

    static boolean isRetryable(IOException e) {
        return !(e instanceof UnknownHostException)
                && !(e instanceof SSLException)
                && !(e instanceof MalformedURLException);
    }

    /**
     * Wait before the given attempt (2 for the first retry): the server's Retry-After on 429 when
     * present, else {@code backoff * 2^(attempt-2)}, never above the maximum.
     */
    Duration delayBefore(int attempt, FetchResult previous) {
        if (previous != null && previous.getStatusCode() == 429) {
            Duration retryAfter = parseRetryAfter(previous.header("Retry-After"));
            if (retryAfter != null) {
                if (retryAfter.compareTo(maxBackoff) > 0) {
                    log.debug("Retry-After of {} ms shortened to the {} ms backoff cap",
                            retryAfter.toMillis(), maxBackoff.toMillis());
                    return maxBackoff;
                }
                return retryAfter;
            }
        }
        int exponent = Math.max(0, Math.min(attempt - 2, 30));
        Duration d = backoff.multipliedBy(1L << exponent);
        return min(d, maxBackoff);
    }

    /** Retry-After as delta-seconds or HTTP date; null when absent or unparseable. */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        if (DELTA_SECONDS.matcher(v).matches()) {
            return Duration.ofSeconds(Long.parseLong(v));
        }
        try {
            Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration d = Duration.between(clock.instant(), at);
            return d.isNegative() ? Duration.ZERO : d;
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable Retry-After '{}'", v);
            return null;
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String describe(FetchResult r) {
        return r.getFailure() != null ? r.errorMessage() : "HTTP " + r.getStatusCode();
    }
}
