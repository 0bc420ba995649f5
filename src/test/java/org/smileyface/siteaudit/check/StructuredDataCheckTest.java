package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StructuredDataCheckTest {

    private final StructuredDataCheck check = new StructuredDataCheck();

    private List<String> issues(PageModel page) {
        return check.check(page, Pages.index(page)).stream().map(Finding::getIssue).toList();
    }

    @Test
    void validBlock_hasNoFindings() {
        PageModel page = Pages.html("/")
                .structuredData("json-ld", "{\"@context\":\"https://schema.org\",\"@type\":\"Organization\"}")
                .build();
        assertThat(issues(page)).isEmpty();
    }

    @Test
    void unparseableBlock_isInvalid() {
        PageModel page = Pages.html("/").structuredData("json-ld", "{\"@type\": \"Thing\",}").build();
        assertThat(issues(page)).containsExactly("invalid-json-ld");
    }

    @Test
    void blocksWithoutContext_areFlagged() {
        PageModel page = Pages.html("/")
                .structuredData("json-ld", "{\"@type\":\"Thing\"}")
                .structuredData("json-ld", "[{\"@context\":\"https://schema.org\"},{\"@type\":\"Person\"}]")
                .structuredData("json-ld", "[{\"@context\":\"https://schema.org\",\"@type\":\"Person\"}]")
                .build();

        List<Finding> findings = check.check(page, Pages.index(page));

        assertThat(findings).extracting(Finding::getIssue).containsExactly("missing-context", "missing-context");
        assertThat(findings).extracting(f -> f.getEvidence().get("block")).containsExactly("1", "2");
    }

    @Test
    void emptyBlock_isInvalid() {
        PageModel page = Pages.html("/").structuredData("json-ld", "   ").build();
        assertThat(issues(page)).containsExactly("invalid-json-ld");
    }
}
