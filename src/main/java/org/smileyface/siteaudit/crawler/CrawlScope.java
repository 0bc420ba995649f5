package org.smileyface.siteaudit.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Decides which discovered URLs belong to the audited site and may be crawled.
 * Internal hosts are the seed host plus any explicitly allowed hosts; on top of that the
 * include/exclude regex filters apply, with excludes taking precedence.
 */
public final class CrawlScope {

    private static final Logger log = LoggerFactory.getLogger(CrawlScope.class);

    private final Set<String> internalHosts;
    private final List<Pattern> includes;
    private final List<Pattern> excludes;

    public CrawlScope(String seedUrl, Collection<String> allowedHosts,
                      Collection<String> includePatterns, Collection<String> excludePatterns) {
        Set<String> hosts = new TreeSet<>();
        String seedHost = UrlNormalizer.hostOf(seedUrl);
        if (seedHost != null) hosts.add(seedHost.toLowerCase(Locale.ROOT));
        if (allowedHosts != null) {
            for (String h : allowedHosts) {
                if (h != null && !h.isBlank()) hosts.add(h.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.internalHosts = Set.copyOf(hosts);
        this.includes = compilePatterns(includePatterns);
        this.excludes = compilePatterns(excludePatterns);
    }

    public Set<String> getInternalHosts() {
        return internalHosts;
    }

    /** True when the URL's host is part of the audited site, regardless of filters. */
    public boolean isInternal(String url) {
        String host = UrlNormalizer.hostOf(url);
        return host != null && internalHosts.contains(host.toLowerCase(Locale.ROOT));
    }

    /** True when the URL is internal and passes the include/exclude filters. */
    public boolean isCrawlable(String url) {
        return isInternal(url) && isAcceptedByFilters(url);
    }

    private boolean isAcceptedByFilters(String url) {
        // Excludes take precedence
        for (Pattern p : excludes) {
            if (p.matcher(url).find()) return false;
        }
        if (includes.isEmpty()) return true;
        for (Pattern p : includes) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compilePatterns(Collection<String> raw) {
        List<Pattern> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            try {
                out.add(Pattern.compile(s));
            } catch (Exception e) {
                log.warn("Invalid regex pattern in crawler config: {} (ignored)", s);
            }
        }
        return List.copyOf(out);
    }
}
