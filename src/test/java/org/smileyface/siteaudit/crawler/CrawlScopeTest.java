package org.smileyface.siteaudit.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CrawlScopeTest {

    @Test
    void internal_isSeedHostPlusAllowedHosts() {
        CrawlScope scope = new CrawlScope("https://example.com/", List.of("Docs.Example.com"), List.of(), List.of());

        assertThat(scope.getInternalHosts()).containsExactlyInAnyOrder("example.com", "docs.example.com");
        assertThat(scope.isInternal("https://example.com/a")).isTrue();
        assertThat(scope.isInternal("http://docs.example.com/x")).isTrue();
        assertThat(scope.isInternal("https://other.org/")).isFalse();
        assertThat(scope.isInternal("https://sub.example.com/")).isFalse();
    }

    @Test
    void crawlable_excludesTakePrecedenceOverIncludes() {
        CrawlScope scope = new CrawlScope("https://example.com/", List.of(),
                List.of("/blog/"), List.of("/blog/drafts/"));

        assertThat(scope.isCrawlable("https://example.com/blog/post")).isTrue();
        assertThat(scope.isCrawlable("https://example.com/blog/drafts/x")).isFalse();
        assertThat(scope.isCrawlable("https://example.com/shop")).isFalse();
        // external URLs are never crawlable, even when they match an include
        assertThat(scope.isCrawlable("https://other.org/blog/post")).isFalse();
    }

    @Test
    void invalidPatternIsIgnored() {
        CrawlScope scope = new CrawlScope("https://example.com/", List.of(), List.of(), List.of("[unclosed"));
        assertThat(scope.isCrawlable("https://example.com/a")).isTrue();
    }
}
