package org.smileyface.siteaudit.crawler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for site audits, bound from {@code crawler.*}.
 * Values are mutable JavaBean properties so Spring can bind them; every crawl session works on the
 * validated immutable snapshot produced by {@link CrawlConfig#from(CrawlerProperties)}.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private static final Logger log = LogManager.getLogger(CrawlerProperties.class);

    static final String DEFAULTS_RESOURCE = "SiteAuditConfig.json";

    /** Entry URL used by the startup runner. */
    private String seedUrl;

    /** Run one audit of {@link #seedUrl} when the application starts. */
    private boolean runOnStartup = false;

    /** Where the startup runner writes the report JSON. */
    private String reportFile = "audit-report.json";

    /**
     * Maximum crawl depth starting from the seed URL. depth=0 means only the seed page.
     */
    private int maxDepth = 3;

    /** Maximum number of URLs admitted into the frontier, seed included. */
    private int maxPages = 500;

    /** Wall-clock limit for the crawl phase in milliseconds, 0 for none. */
    private long timeLimitMs = 0;

    /** Number of fetch workers. */
    private int workerCount = 4;

    /** Maximum simultaneous requests per origin. */
    private int perHostConcurrency = 2;

    /** Minimum spacing between request starts on one origin. */
    private long minCrawlDelayMs = 500;

    /** Cap applied to a robots.txt Crawl-delay. */
    private long maxCrawlDelayMs = 30000;

    /** Fetch timeout in milliseconds. */
    private int requestTimeoutMs = 10000;

    /** User agent sent with every request; its product token is matched against robots.txt groups. */
    private String userAgent = "SiteAuditBot/1.0";

    private TrailingSlashPolicy trailingSlashPolicy = TrailingSlashPolicy.PRESERVE;

    /** Query parameters removed during normalization; entries ending in '*' are prefixes. */
    private List<String> stripQueryParams = new ArrayList<>(List.of("utm_*", "gclid", "fbclid", "msclkid"));

    private int maxRetries = 2;

    private long retryBackoffMs = 500;

    private long retryBackoffMaxMs = 8000;

    private int maxRedirects = 10;

    /** Largest response body read, in bytes. 0 means unlimited. */
    private int maxBodySizeBytes = 5 * 1024 * 1024;

    /** Also fetch same-site images, scripts and stylesheets so their status is known. */
    private boolean crawlResources = true;

    /**
     * List of Java regex patterns; a URL must match at least one include (if provided) to be accepted.
     */
    private List<String> includeUrlPatterns = new ArrayList<>();

    /**
     * List of Java regex patterns; a URL matching any exclude will be rejected.
     */
    private List<String> excludeUrlPatterns = new ArrayList<>();

    /** Hosts treated as part of the audited site in addition to the seed host. */
    private List<String> allowedHosts = new ArrayList<>();

    private Checks checks = new Checks();

    /**
     * Loads default values from classpath resource SiteAuditConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public CrawlerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper();
                SiteAuditConfig cfg = mapper.readValue(in, SiteAuditConfig.class);
                apply(cfg);
            }
        } catch (Exception e) {
            // compiled-in defaults stay in place
            log.error("Failed to load default crawler configuration from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
    }

    private void apply(SiteAuditConfig cfg) {
        if (cfg.maxDepth != null) this.maxDepth = cfg.maxDepth;
        if (cfg.maxPages != null) this.maxPages = cfg.maxPages;
        if (cfg.timeLimitMs != null) this.timeLimitMs = cfg.timeLimitMs;
        if (cfg.workerCount != null) this.workerCount = cfg.workerCount;
        if (cfg.perHostConcurrency != null) this.perHostConcurrency = cfg.perHostConcurrency;
        if (cfg.minCrawlDelayMs != null) this.minCrawlDelayMs = cfg.minCrawlDelayMs;
        if (cfg.maxCrawlDelayMs != null) this.maxCrawlDelayMs = cfg.maxCrawlDelayMs;
        if (cfg.requestTimeoutMs != null && cfg.requestTimeoutMs > 0) this.requestTimeoutMs = cfg.requestTimeoutMs;
        if (cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
        if (cfg.trailingSlashPolicy != null) this.trailingSlashPolicy = cfg.trailingSlashPolicy;
        if (cfg.stripQueryParams != null) this.stripQueryParams = new ArrayList<>(cfg.stripQueryParams);
        if (cfg.maxRetries != null) this.maxRetries = cfg.maxRetries;
        if (cfg.retryBackoffMs != null) this.retryBackoffMs = cfg.retryBackoffMs;
        if (cfg.retryBackoffMaxMs != null) this.retryBackoffMaxMs = cfg.retryBackoffMaxMs;
        if (cfg.maxRedirects != null) this.maxRedirects = cfg.maxRedirects;
        if (cfg.maxBodySizeBytes != null) this.maxBodySizeBytes = cfg.maxBodySizeBytes;
        if (cfg.crawlResources != null) this.crawlResources = cfg.crawlResources;
        if (cfg.includeUrlPatterns != null) this.includeUrlPatterns = new ArrayList<>(cfg.includeUrlPatterns);
        if (cfg.excludeUrlPatterns != null) this.excludeUrlPatterns = new ArrayList<>(cfg.excludeUrlPatterns);
        if (cfg.allowedHosts != null) this.allowedHosts = new ArrayList<>(cfg.allowedHosts);
        if (cfg.checks != null) this.checks = cfg.checks;
    }

    /**
     * Independent copy, used when a request overrides part of the configuration for one session.
     */
    public CrawlerProperties copy() {
        CrawlerProperties c = new CrawlerProperties();
        c.seedUrl = seedUrl;
        c.runOnStartup = runOnStartup;
        c.reportFile = reportFile;
        c.maxDepth = maxDepth;
        c.maxPages = maxPages;
        c.timeLimitMs = timeLimitMs;
        c.workerCount = workerCount;
        c.perHostConcurrency = perHostConcurrency;
        c.minCrawlDelayMs = minCrawlDelayMs;
        c.maxCrawlDelayMs = maxCrawlDelayMs;
        c.requestTimeoutMs = requestTimeoutMs;
        c.userAgent = userAgent;
        c.trailingSlashPolicy = trailingSlashPolicy;
        c.stripQueryParams = new ArrayList<>(stripQueryParams);
        c.maxRetries = maxRetries;
        c.retryBackoffMs = retryBackoffMs;
        c.retryBackoffMaxMs = retryBackoffMaxMs;
        c.maxRedirects = maxRedirects;
        c.maxBodySizeBytes = maxBodySizeBytes;
        c.crawlResources = crawlResources;
        c.includeUrlPatterns = new ArrayList<>(includeUrlPatterns);
        c.excludeUrlPatterns = new ArrayList<>(excludeUrlPatterns);
        c.allowedHosts = new ArrayList<>(allowedHosts);
        c.checks = checks.copy();
        return c;
    }

    public String getSeedUrl() { return seedUrl; }
    public void setSeedUrl(String seedUrl) { this.seedUrl = seedUrl; }

    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

    public String getReportFile() { return reportFile; }
    public void setReportFile(String reportFile) { this.reportFile = reportFile; }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public int getMaxPages() { return maxPages; }
    public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

    public long getTimeLimitMs() { return timeLimitMs; }
    public void setTimeLimitMs(long timeLimitMs) { this.timeLimitMs = timeLimitMs; }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public int getPerHostConcurrency() { return perHostConcurrency; }
    public void setPerHostConcurrency(int perHostConcurrency) { this.perHostConcurrency = perHostConcurrency; }

    public long getMinCrawlDelayMs() { return minCrawlDelayMs; }
    public void setMinCrawlDelayMs(long minCrawlDelayMs) { this.minCrawlDelayMs = minCrawlDelayMs; }

    public long getMaxCrawlDelayMs() { return maxCrawlDelayMs; }
    public void setMaxCrawlDelayMs(long maxCrawlDelayMs) { this.maxCrawlDelayMs = maxCrawlDelayMs; }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public TrailingSlashPolicy getTrailingSlashPolicy() { return trailingSlashPolicy; }
    public void setTrailingSlashPolicy(TrailingSlashPolicy trailingSlashPolicy) { this.trailingSlashPolicy = trailingSlashPolicy; }

    public List<String> getStripQueryParams() { return stripQueryParams; }
    public void setStripQueryParams(List<String> stripQueryParams) {
        this.stripQueryParams = stripQueryParams != null ? stripQueryParams : new ArrayList<>();
    }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public long getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }

    public long getRetryBackoffMaxMs() { return retryBackoffMaxMs; }
    public void setRetryBackoffMaxMs(long retryBackoffMaxMs) { this.retryBackoffMaxMs = retryBackoffMaxMs; }

    public int getMaxRedirects() { return maxRedirects; }
    public void setMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; }

    public int getMaxBodySizeBytes() { return maxBodySizeBytes; }
    public void setMaxBodySizeBytes(int maxBodySizeBytes) { this.maxBodySizeBytes = maxBodySizeBytes; }

    public boolean isCrawlResources() { return crawlResources; }
    public void setCrawlResources(boolean crawlResources) { this.crawlResources = crawlResources; }

    public List<String> getIncludeUrlPatterns() { return includeUrlPatterns; }
    public void setIncludeUrlPatterns(List<String> includeUrlPatterns) {
        this.includeUrlPatterns = includeUrlPatterns != null ? includeUrlPatterns : new ArrayList<>();
    }

    public List<String> getExcludeUrlPatterns() { return excludeUrlPatterns; }
    public void setExcludeUrlPatterns(List<String> excludeUrlPatterns) {
        this.excludeUrlPatterns = excludeUrlPatterns != null ? excludeUrlPatterns : new ArrayList<>();
    }

    public List<String> getAllowedHosts() { return allowedHosts; }
    public void setAllowedHosts(List<String> allowedHosts) {
        this.allowedHosts = allowedHosts != null ? allowedHosts : new ArrayList<>();
    }

    public Checks getChecks() { return checks; }
    public void setChecks(Checks checks) { this.checks = checks != null ? checks : new Checks(); }

    /**
     * Thresholds of the built-in checks, bound from {@code crawler.checks.*}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Checks {
        private int redirectHopLimit = 3;
        private int titleMinLength = 10;
        private int titleMaxLength = 60;
        private int descriptionMinLength = 50;
        private int descriptionMaxLength = 160;
        private long slowResponseMs = 3000;
        private int checkParallelism = 4;
        private List<String> disabled = new ArrayList<>();

        Checks copy() {
            Checks c = new Checks();
            c.redirectHopLimit = redirectHopLimit;
            c.titleMinLength = titleMinLength;
            c.titleMaxLength = titleMaxLength;
            c.descriptionMinLength = descriptionMinLength;
            c.descriptionMaxLength = descriptionMaxLength;
            c.slowResponseMs = slowResponseMs;
            c.checkParallelism = checkParallelism;
            c.disabled = new ArrayList<>(disabled);
            return c;
        }

        public int getRedirectHopLimit() { return redirectHopLimit; }
        public void setRedirectHopLimit(int redirectHopLimit) { this.redirectHopLimit = redirectHopLimit; }

        public int getTitleMinLength() { return titleMinLength; }
        public void setTitleMinLength(int titleMinLength) { this.titleMinLength = titleMinLength; }

        public int getTitleMaxLength() { return titleMaxLength; }
        public void setTitleMaxLength(int titleMaxLength) { this.titleMaxLength = titleMaxLength; }

        public int getDescriptionMinLength() { return descriptionMinLength; }
        public void setDescriptionMinLength(int descriptionMinLength) { this.descriptionMinLength = descriptionMinLength; }

        public int getDescriptionMaxLength() { return descriptionMaxLength; }
        public void setDescriptionMaxLength(int descriptionMaxLength) { this.descriptionMaxLength = descriptionMaxLength; }

        public long getSlowResponseMs() { return slowResponseMs; }
        public void setSlowResponseMs(long slowResponseMs) { this.slowResponseMs = slowResponseMs; }

        public int getCheckParallelism() { return checkParallelism; }
        public void setCheckParallelism(int checkParallelism) { this.checkParallelism = checkParallelism; }

        public List<String> getDisabled() { return disabled; }
        public void setDisabled(List<String> disabled) { this.disabled = disabled != null ? disabled : new ArrayList<>(); }
    }

    // --------- Nested config DTO for JSON mapping ---------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SiteAuditConfig {
        public Integer maxDepth;
        public Integer maxPages;
        public Long timeLimitMs;
        public Integer workerCount;
        public Integer perHostConcurrency;
        public Long minCrawlDelayMs;
        public Long maxCrawlDelayMs;
        public Integer requestTimeoutMs;
        public String userAgent;
        public TrailingSlashPolicy trailingSlashPolicy;
        public List<String> stripQueryParams;
        public Integer maxRetries;
        public Long retryBackoffMs;
        public Long retryBackoffMaxMs;
        public Integer maxRedirects;
        public Integer maxBodySizeBytes;
        public Boolean crawlResources;
        public List<String> includeUrlPatterns;
        public List<String> excludeUrlPatterns;
        public List<String> allowedHosts;
        public Checks checks;
    }
}
