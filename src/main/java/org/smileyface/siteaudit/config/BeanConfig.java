package org.smileyface.siteaudit.config;

import org.smileyface.siteaudit.check.CheckRegistry;
import org.smileyface.siteaudit.fetch.JsoupPageFetcher;
import org.smileyface.siteaudit.fetch.PageFetcherFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the HTTP client used by crawl sessions and the registry for checks beyond the built-in ones.
 */
@Configuration
public class BeanConfig {

    /**
     * One Jsoup-backed fetcher per session, configured from that session's user agent, timeout
     * and body size limit.
     */
    @Bean
    @ConditionalOnMissingBean
    public PageFetcherFactory pageFetcherFactory() {
        return config -> new JsoupPageFetcher(config.userAgent(), config.requestTimeout(), config.maxBodySizeBytes());
    }

    /**
     * Empty by default; other configuration can add checks to it before the first audit.
     */
    @Bean
    @ConditionalOnMissingBean
    public CheckRegistry extraChecks() {
        return new CheckRegistry();
    }
}
