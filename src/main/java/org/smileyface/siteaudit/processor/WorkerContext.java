package org.smileyface.siteaudit.processor;

import org.smileyface.siteaudit.crawler.CrawlScope;
import org.smileyface.siteaudit.crawler.Frontier;
import org.smileyface.siteaudit.crawler.PolitenessGate;
import org.smileyface.siteaudit.extractor.PageModelBuilder;
import org.smileyface.siteaudit.fetch.RedirectingFetcher;
import org.smileyface.siteaudit.fetch.RetryPolicy;
import org.smileyface.siteaudit.model.PageModel;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collaborators shared by all workers of one crawl session.
 *
 * @param crawlResources also enqueue same-site resource links found on HTML pages
 * @param sink           receives every built page model; must be safe for concurrent use
 */
public record WorkerContext(Frontier frontier,
                            PolitenessGate gate,
                            RedirectingFetcher fetcher,
                            RetryPolicy retryPolicy,
                            PageModelBuilder builder,
                            CrawlScope scope,
                            boolean crawlResources,
                            Consumer<PageModel> sink) {

    public WorkerContext {
        Objects.requireNonNull(frontier, "frontier");
        Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(builder, "builder");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(sink, "sink");
    }
}
