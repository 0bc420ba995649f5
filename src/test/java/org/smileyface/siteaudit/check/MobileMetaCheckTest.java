package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MobileMetaCheckTest {

    private final MobileMetaCheck check = new MobileMetaCheck();

    private List<String> issues(PageModel page) {
        return check.check(page, Pages.index(page)).stream().map(Finding::getIssue).toList();
    }

    @Test
    void viewportVariants() {
        assertThat(issues(Pages.html("/ok").metaTag("viewport", "width=device-width, initial-scale=1").build())).isEmpty();
        assertThat(issues(Pages.html("/none").build())).containsExactly("missing-viewport");
        assertThat(issues(Pages.html("/fixed").metaTag("viewport", "width=980").build()))
                .containsExactly("viewport-not-device-width");
        assertThat(issues(Pages.html("/nozoom").metaTag("viewport", "width=device-width, user-scalable=no").build()))
                .containsExactly("zoom-disabled");
        assertThat(issues(Pages.html("/maxscale").metaTag("viewport", "width=device-width; maximum-scale=1.0").build()))
                .containsExactly("zoom-disabled");
    }

    @Test
    void nonHtmlPages_areSkipped() {
        PageModel image = PageModel.builder(Pages.SITE + "/logo.png").statusCode(200).contentType("image/png").build();
        assertThat(issues(image)).isEmpty();
    }

    @Test
    void parse_isCaseInsensitiveAndTolerant() {
        assertThat(MobileMetaCheck.parse("Width = Device-Width ,initial-scale=1, bogus"))
                .containsEntry("width", "device-width")
                .containsEntry("initial-scale", "1")
                .doesNotContainKey("bogus");
    }
}
