package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.PageModel;

import static org.assertj.core.api.Assertions.*;

class IndexabilityCheckTest {

    private final IndexabilityCheck check = new IndexabilityCheck();

    @Test
    void noindexFromMetaOrHeader_isNoted() {
        PageModel meta = Pages.html("/m").metaTag("robots", "NOINDEX, follow").build();
        PageModel header = PageModel.builder(Pages.SITE + "/doc.pdf").statusCode(200)
                .header("x-robots-tag", "none").build();
        PageModel plain = Pages.html("/p").metaTag("robots", "index, follow").build();

        assertThat(check.check(meta, Pages.index(meta))).singleElement()
                .satisfies(f -> assertThat(f.getEvidence()).containsEntry("source", "meta"));
        assertThat(check.check(header, Pages.index(header))).singleElement()
                .satisfies(f -> assertThat(f.getEvidence()).containsEntry("source", "header"));
        assertThat(check.check(plain, Pages.index(plain))).isEmpty();
    }

    @Test
    void hasNoindex_tokenizesDirectives() {
        assertThat(IndexabilityCheck.hasNoindex("noindex")).isTrue();
        assertThat(IndexabilityCheck.hasNoindex("max-snippet:10,noindex")).isTrue();
        assertThat(IndexabilityCheck.hasNoindex("noindexer")).isFalse();
        assertThat(IndexabilityCheck.hasNoindex(null)).isFalse();
    }
}
