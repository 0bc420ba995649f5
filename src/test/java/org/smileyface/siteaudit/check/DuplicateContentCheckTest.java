package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import static org.assertj.core.api.Assertions.*;

class DuplicateContentCheckTest {

    private final DuplicateContentCheck check = new DuplicateContentCheck();

    @Test
    void pagesWithSameBodyHash_pointAtEachOther() {
        PageModel a = Pages.html("/a").bodyHash("h1").build();
        PageModel b = Pages.html("/b").bodyHash("h1").build();
        PageModel c = Pages.html("/c").bodyHash("h2").build();
        CrawlIndex index = Pages.index(a, b, c);

        assertThat(check.check(a, index)).singleElement().satisfies(f -> {
            assertThat(f.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(f.getEvidence()).containsEntry("duplicates", "https://example.com/b");
        });
        assertThat(check.check(b, index)).extracting(Finding::getIssue).containsExactly("duplicate-body");
        assertThat(check.check(c, index)).isEmpty();
    }

    @Test
    void errorPages_areNotComparedEvenWithSameBody() {
        PageModel a = Pages.html("/missing1").statusCode(404).bodyHash("nf").build();
        PageModel b = Pages.html("/missing2").statusCode(404).bodyHash("nf").build();
        CrawlIndex index = Pages.index(a, b);

        assertThat(check.check(a, index)).isEmpty();
    }
}
