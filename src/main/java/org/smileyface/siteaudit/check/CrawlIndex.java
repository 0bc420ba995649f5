package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.crawler.CrawlScope;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.UrlRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable view over a finished crawl: pages by requested URL, URL outcomes, and lookups by body hash,
 * title and description used by the cross-page checks. Only 2xx HTML pages take part in those lookups.
 */
public final class CrawlIndex {

    private final Map<String, PageModel> pages;
    private final Map<String, UrlRecord> outcomes;
    private final CrawlScope scope;
    private final Map<String, Set<String>> byBodyHash;
    private final Map<String, Set<String>> byTitle;
    private final Map<String, Set<String>> byDescription;

    private CrawlIndex(Map<String, PageModel> pages, Map<String, UrlRecord> outcomes, CrawlScope scope) {
        this.pages = Collections.unmodifiableMap(pages);
        this.outcomes = Collections.unmodifiableMap(outcomes);
        this.scope = scope;
        Map<String, Set<String>> hashes = new HashMap<>();
        Map<String, Set<String>> titles = new HashMap<>();
        Map<String, Set<String>> descriptions = new HashMap<>();
        for (PageModel p : pages.values()) {
            if (!p.isAuditableHtml()) continue;
            index(hashes, p.getBodyHash(), p.getUrl());
            index(titles, trimmed(p.getTitle()), p.getUrl());
            index(descriptions, trimmed(p.meta("description")), p.getUrl());
        }
        this.byBodyHash = freeze(hashes);
        this.byTitle = freeze(titles);
        this.byDescription = freeze(descriptions);
    }

    public static CrawlIndex of(Collection<PageModel> pages, Collection<UrlRecord> inventory, CrawlScope scope) {
        Map<String, PageModel> byUrl = new LinkedHashMap<>();
        for (PageModel p : pages) {
            byUrl.put(p.getUrl(), p);
        }
        Map<String, UrlRecord> outcomes = new HashMap<>();
        for (UrlRecord r : inventory) {
            outcomes.put(r.getUrl(), r);
        }
        return new CrawlIndex(byUrl, outcomes, scope);
    }

    public Collection<PageModel> pages() {
        return pages.values();
    }

    public Optional<PageModel> page(String url) {
        return Optional.ofNullable(pages.get(url));
    }

    /** Terminal record of a visited URL; empty when the URL was never crawled. */
    public Optional<UrlRecord> outcomeOf(String url) {
        return Optional.ofNullable(outcomes.get(url));
    }

    public boolean isInternal(String url) {
        return scope.isInternal(url);
    }

    public Set<String> urlsWithBodyHash(String hash) {
        return lookup(byBodyHash, hash);
    }

    public Set<String> urlsWithTitle(String title) {
        return lookup(byTitle, trimmed(title));
    }

    public Set<String> urlsWithDescription(String description) {
        return lookup(byDescription, trimmed(description));
    }

    private static Set<String> lookup(Map<String, Set<String>> index, String key) {
        if (key == null) return Set.of();
        return index.getOrDefault(key, Set.of());
    }

    private static void index(Map<String, Set<String>> index, String key, String url) {
        if (key == null) return;
        index.computeIfAbsent(key, k -> new TreeSet<>()).add(url);
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> index) {
        Map<String, Set<String>> out = new HashMap<>();
        index.forEach((k, v) -> out.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(out);
    }

    private static String trimmed(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
