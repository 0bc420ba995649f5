package org.smileyface.siteaudit.crawler;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable, validated configuration of one crawl session.
 * <p>
 * Obtained through {@link #from(CrawlerProperties)}, which rejects unusable values with an
 * {@link InvalidConfigurationException} before anything is fetched. The seed URL is stored normalized.
 */
public record CrawlConfig(
        String seedUrl,
        int maxDepth,
        int maxPages,
        Duration timeLimit,
        int workerCount,
        int perHostConcurrency,
        Duration minCrawlDelay,
        Duration maxCrawlDelay,
        Duration requestTimeout,
        String userAgent,
        TrailingSlashPolicy trailingSlashPolicy,
        List<String> stripQueryParams,
        int maxRetries,
        Duration retryBackoff,
        Duration retryBackoffMax,
        int maxRedirects,
        int maxBodySizeBytes,
        boolean crawlResources,
        List<String> includeUrlPatterns,
        List<String> excludeUrlPatterns,
        List<String> allowedHosts,
        CheckSettings checks) {

    public static final int MAX_PER_HOST_CONCURRENCY = 16;

    public CrawlConfig {
        stripQueryParams = List.copyOf(stripQueryParams);
        includeUrlPatterns = List.copyOf(includeUrlPatterns);
        excludeUrlPatterns = List.copyOf(excludeUrlPatterns);
        allowedHosts = List.copyOf(allowedHosts);
    }

    /**
     * Thresholds for the built-in checks.
     */
    public record CheckSettings(int redirectHopLimit,
                                int titleMinLength,
                                int titleMaxLength,
                                int descriptionMinLength,
                                int descriptionMaxLength,
                                Duration slowResponse,
                                int checkParallelism,
                                Set<String> disabled) {

        public CheckSettings {
            disabled = Set.copyOf(disabled);
        }

        public boolean isEnabled(String checkId) {
            return !disabled.contains(checkId);
        }
    }

    public static CrawlConfig from(CrawlerProperties p) {
        return from(p, p.getSeedUrl());
    }

    /**
     * Validates the properties and snapshots them with the given seed URL.
     *
     * @throws InvalidConfigurationException when a value is out of range or the seed cannot be normalized
     */
    public static CrawlConfig from(CrawlerProperties p, String seedUrl) {
        if (p == null) {
            throw new InvalidConfigurationException("Crawler properties are required");
        }
        UrlNormalizer normalizer = new UrlNormalizer(p.getTrailingSlashPolicy(), p.getStripQueryParams());
        if (seedUrl == null || seedUrl.isBlank()) {
            throw new InvalidConfigurationException("Seed URL is required");
        }
        String seed;
        try {
            seed = normalizer.normalize(seedUrl);
        } catch (NormalizationException e) {
            throw new InvalidConfigurationException("Invalid seed URL '" + seedUrl + "': " + e.getMessage(), e);
        }

        require(p.getMaxDepth() >= 0, "maxDepth must be >= 0, was " + p.getMaxDepth());
        require(p.getMaxPages() >= 1, "maxPages must be >= 1, was " + p.getMaxPages());
        require(p.getTimeLimitMs() >= 0, "timeLimitMs must be >= 0, was " + p.getTimeLimitMs());
        require(p.getWorkerCount() >= 1, "workerCount must be >= 1, was " + p.getWorkerCount());
        require(p.getPerHostConcurrency() >= 1 && p.getPerHostConcurrency() <= MAX_PER_HOST_CONCURRENCY,
                "perHostConcurrency must be between 1 and " + MAX_PER_HOST_CONCURRENCY + ", was " + p.getPerHostConcurrency());
        require(p.getMinCrawlDelayMs() >= 0, "minCrawlDelayMs must be >= 0, was " + p.getMinCrawlDelayMs());
        require(p.getMaxCrawlDelayMs() >= p.getMinCrawlDelayMs(),
                "maxCrawlDelayMs must be >= minCrawlDelayMs, was " + p.getMaxCrawlDelayMs());
        require(p.getRequestTimeoutMs() > 0, "requestTimeoutMs must be > 0, was " + p.getRequestTimeoutMs());
        require(p.getUserAgent() != null && !p.getUserAgent().isBlank(), "userAgent is required");
        require(p.getMaxRetries() >= 0, "maxRetries must be >= 0, was " + p.getMaxRetries());
        require(p.getRetryBackoffMs() >= 0, "retryBackoffMs must be >= 0, was " + p.getRetryBackoffMs());
        require(p.getRetryBackoffMaxMs() >= p.getRetryBackoffMs(),
                "retryBackoffMaxMs must be >= retryBackoffMs, was " + p.getRetryBackoffMaxMs());
        require(p.getMaxRedirects() >= 0, "maxRedirects must be >= 0, was " + p.getMaxRedirects());
        require(p.getMaxBodySizeBytes() >= 0, "maxBodySizeBytes must be >= 0, was " + p.getMaxBodySizeBytes());

        CrawlerProperties.Checks c = p.getChecks();
        require(c.getRedirectHopLimit() >= 0, "checks.redirectHopLimit must be >= 0");
        require(c.getTitleMinLength() >= 0 && c.getTitleMinLength() <= c.getTitleMaxLength(),
                "checks.titleMinLength must be between 0 and checks.titleMaxLength");
        require(c.getDescriptionMinLength() >= 0 && c.getDescriptionMinLength() <= c.getDescriptionMaxLength(),
                "checks.descriptionMinLength must be between 0 and checks.descriptionMaxLength");
        require(c.getSlowResponseMs() > 0, "checks.slowResponseMs must be > 0");
        require(c.getCheckParallelism() >= 1, "checks.checkParallelism must be >= 1");

        CheckSettings checks = new CheckSettings(
                c.getRedirectHopLimit(),
                c.getTitleMinLength(),
                c.getTitleMaxLength(),
                c.getDescriptionMinLength(),
                c.getDescriptionMaxLength(),
                Duration.ofMillis(c.getSlowResponseMs()),
                c.getCheckParallelism(),
                Set.copyOf(c.getDisabled()));

        return new CrawlConfig(
                seed,
                p.getMaxDepth(),
                p.getMaxPages(),
                Duration.ofMillis(p.getTimeLimitMs()),
                p.getWorkerCount(),
                p.getPerHostConcurrency(),
                Duration.ofMillis(p.getMinCrawlDelayMs()),
                Duration.ofMillis(p.getMaxCrawlDelayMs()),
                Duration.ofMillis(p.getRequestTimeoutMs()),
                p.getUserAgent().trim(),
                p.getTrailingSlashPolicy() == null ? TrailingSlashPolicy.PRESERVE : p.getTrailingSlashPolicy(),
                p.getStripQueryParams(),
                p.getMaxRetries(),
                Duration.ofMillis(p.getRetryBackoffMs()),
                Duration.ofMillis(p.getRetryBackoffMaxMs()),
                p.getMaxRedirects(),
                p.getMaxBodySizeBytes(),
                p.isCrawlResources(),
                p.getIncludeUrlPatterns(),
                p.getExcludeUrlPatterns(),
                p.getAllowedHosts(),
                checks);
    }

    public boolean hasTimeLimit() {
        return !timeLimit.isZero();
    }

    public UrlNormalizer normalizer() {
        return new UrlNormalizer(trailingSlashPolicy, stripQueryParams);
    }

    public CrawlScope scope() {
        return new CrawlScope(seedUrl, allowedHosts, includeUrlPatterns, excludeUrlPatterns);
    }

    /**
     * Product token matched against robots.txt user-agent groups: the user agent up to the first
     * '/' or space, lower-cased. "SiteAuditBot/1.0 (+https://example.com)" gives "siteauditbot".
     */
    public String robotToken() {
        return robotToken(userAgent);
    }

    static String robotToken(String userAgent) {
        String ua = userAgent.trim();
        int end = ua.length();
        int slash = ua.indexOf('/');
        if (slash >= 0) end = Math.min(end, slash);
        int space = ua.indexOf(' ');
        if (space >= 0) end = Math.min(end, space);
        String token = ua.substring(0, end).toLowerCase(Locale.ROOT);
        return token.isEmpty() ? "*" : token;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidConfigurationException(message);
        }
    }
}
