package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.RedirectHop;
import org.smileyface.siteaudit.model.Severity;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CanonicalIntegrityCheckTest {

    private final CanonicalIntegrityCheck check = new CanonicalIntegrityCheck();

    @Test
    void selfCanonical_isFine() {
        PageModel page = Pages.html("/a").canonical(Pages.SITE + "/a").build();
        assertThat(check.check(page, Pages.index(page))).isEmpty();
    }

    @Test
    void malformedCanonical_isWarning() {
        PageModel page = Pages.html("/a").canonicalRaw("http://[x").build();
        assertThat(check.check(page, Pages.index(page))).singleElement()
                .extracting(Finding::getIssue, Finding::getSeverity)
                .containsExactly("malformed-canonical", Severity.WARNING);
    }

    @Test
    void redirectLandingElsewhere_conflictsWithCanonical() {
        PageModel page = Pages.html("/old")
                .finalUrl(Pages.SITE + "/new")
                .redirectChain(List.of(new RedirectHop(Pages.SITE + "/old", 301, Pages.SITE + "/new")))
                .canonical(Pages.SITE + "/other")
                .build();

        assertThat(check.check(page, Pages.index(page))).singleElement().satisfies(f -> {
            assertThat(f.getIssue()).isEqualTo("canonical-redirect-conflict");
            assertThat(f.getSeverity()).isEqualTo(Severity.INFO);
            assertThat(f.getEvidence()).containsEntry("finalUrl", Pages.SITE + "/new");
        });
    }

    @Test
    void canonicalPointingAtBrokenPage_isWarning() {
        PageModel page = Pages.html("/a").canonical(Pages.SITE + "/gone").build();
        CrawlIndex index = Pages.index(List.of(page), Pages.fetched("/gone", 404));

        assertThat(check.check(page, index)).extracting(Finding::getIssue).containsExactly("canonical-target-broken");
    }
}
