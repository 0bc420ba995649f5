package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import static org.assertj.core.api.Assertions.*;

class MalformedLinkCheckTest {

    @Test
    void oneWarningPerMalformedLink() {
        PageModel page = Pages.html("/").malformedLink("http://[a").malformedLink("http://exa mple.com/").build();

        assertThat(new MalformedLinkCheck().check(page, Pages.index(page)))
                .extracting(f -> f.getEvidence().get("href"), Finding::getSeverity)
                .containsExactly(tuple("http://[a", Severity.WARNING), tuple("http://exa mple.com/", Severity.WARNING));
    }

    @Test
    void parseErrors_areSummarizedOnce() {
        PageModel page = Pages.html("/").parseError("1: a").parseError("2: b").build();

        assertThat(new MalformedMarkupCheck().check(page, Pages.index(page))).singleElement().satisfies(f -> {
            assertThat(f.getIssue()).isEqualTo("parse-errors");
            assertThat(f.getSeverity()).isEqualTo(Severity.INFO);
            assertThat(f.getEvidence()).containsEntry("count", "2").containsEntry("sample", "1: a | 2: b");
        });
    }
}
