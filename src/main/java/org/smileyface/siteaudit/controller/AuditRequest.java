package org.smileyface.siteaudit.controller;

import org.smileyface.siteaudit.crawler.CrawlerProperties;

import java.util.List;

/**
 * Body of {@code POST /api/audits}. Only {@code seedUrl} is required; any other field set here
 * overrides the configured value for this audit only.
 */
public class AuditRequest {

    private String seedUrl;
    private Integer maxDepth;
    private Integer maxPages;
    private Long timeLimitMs;
    private Integer workerCount;
    private Long minCrawlDelayMs;
    private String userAgent;
    private Boolean crawlResources;
    private List<String> includeUrlPatterns;
    private List<String> excludeUrlPatterns;
    private List<String> disabledChecks;

    /** Applies the overrides to {@code props} in place and returns it. */
    CrawlerProperties applyTo(CrawlerProperties props) {
        props.setSeedUrl(seedUrl);
        if (maxDepth != null) props.setMaxDepth(maxDepth);
        if (maxPages != null) props.setMaxPages(maxPages);
        if (timeLimitMs != null) props.setTimeLimitMs(timeLimitMs);
        if (workerCount != null) props.setWorkerCount(workerCount);
        if (minCrawlDelayMs != null) props.setMinCrawlDelayMs(minCrawlDelayMs);
        if (userAgent != null) props.setUserAgent(userAgent);
        if (crawlResources != null) props.setCrawlResources(crawlResources);
        if (includeUrlPatterns != null) props.setIncludeUrlPatterns(includeUrlPatterns);
        if (excludeUrlPatterns != null) props.setExcludeUrlPatterns(excludeUrlPatterns);
        if (disabledChecks != null) props.getChecks().setDisabled(disabledChecks);
        return props;
    }

    public String getSeedUrl() { return seedUrl; }
    public void setSeedUrl(String seedUrl) { this.seedUrl = seedUrl; }

    public Integer getMaxDepth() { return maxDepth; }
    public void setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; }

    public Integer getMaxPages() { return maxPages; }
    public void setMaxPages(Integer maxPages) { this.maxPages = maxPages; }

    public Long getTimeLimitMs() { return timeLimitMs; }
    public void setTimeLimitMs(Long timeLimitMs) { this.timeLimitMs = timeLimitMs; }

    public Integer getWorkerCount() { return workerCount; }
    public void setWorkerCount(Integer workerCount) { this.workerCount = workerCount; }

    public Long getMinCrawlDelayMs() { return minCrawlDelayMs; }
    public void setMinCrawlDelayMs(Long minCrawlDelayMs) { this.minCrawlDelayMs = minCrawlDelayMs; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public Boolean getCrawlResources() { return crawlResources; }
    public void setCrawlResources(Boolean crawlResources) { this.crawlResources = crawlResources; }

    public List<String> getIncludeUrlPatterns() { return includeUrlPatterns; }
    public void setIncludeUrlPatterns(List<String> includeUrlPatterns) { this.includeUrlPatterns = includeUrlPatterns; }

    public List<String> getExcludeUrlPatterns() { return excludeUrlPatterns; }
    public void setExcludeUrlPatterns(List<String> excludeUrlPatterns) { this.excludeUrlPatterns = excludeUrlPatterns; }

    public List<String> getDisabledChecks() { return disabledChecks; }
    public void setDisabledChecks(List<String> disabledChecks) { this.disabledChecks = disabledChecks; }
}
