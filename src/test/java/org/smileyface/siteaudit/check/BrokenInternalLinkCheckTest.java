package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;
import org.smileyface.siteaudit.model.UrlRecord;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BrokenInternalLinkCheckTest {

    private final BrokenInternalLinkCheck check = new BrokenInternalLinkCheck();

    @Test
    void brokenTargets_areReportedBySeverity() {
        PageModel home = Pages.html("/")
                .outboundLink(Pages.SITE + "/ok")
                .outboundLink(Pages.SITE + "/missing")
                .outboundLink(Pages.SITE + "/down")
                .outboundLink(Pages.SITE + "/private")
                .outboundLink(Pages.SITE + "/never-crawled")
                .outboundLink("https://external.org/missing")
                .resourceLink(Pages.SITE + "/img/gone.png")
                .build();
        CrawlIndex index = Pages.index(List.of(home),
                Pages.fetched("/ok", 200),
                Pages.fetched("/missing", 404),
                Pages.failed("/down"),
                UrlRecord.skippedByRobots(Pages.SITE + "/private", 1, Pages.SITE + "/"),
                Pages.fetched("/img/gone.png", 410));

        List<Finding> findings = check.check(home, index);

        assertThat(findings).extracting(f -> f.getEvidence().get("target"), Finding::getSeverity)
                .containsExactlyInAnyOrder(
                        tuple(Pages.SITE + "/missing", Severity.WARNING),
                        tuple(Pages.SITE + "/down", Severity.CRITICAL),
                        tuple(Pages.SITE + "/img/gone.png", Severity.WARNING));
    }

    @Test
    void nonHtmlOrFailedPages_areNotInspected() {
        PageModel failed = Pages.html("/x").statusCode(500).outboundLink(Pages.SITE + "/missing").build();
        CrawlIndex index = Pages.index(List.of(failed), Pages.fetched("/missing", 404));

        assertThat(check.check(failed, index)).isEmpty();
    }
}
