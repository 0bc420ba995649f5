package org.smileyface.siteaudit.check;

import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.model.PageModel;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class SlowResponseCheckTest {

    private final SlowResponseCheck check = new SlowResponseCheck(Duration.ofMillis(1000));

    @Test
    void onlyResponsesAboveThreshold_areNoted() {
        PageModel fast = Pages.html("/fast").fetchLatencyMs(1000).build();
        PageModel slow = Pages.html("/slow").fetchLatencyMs(2500).build();
        PageModel failed = PageModel.builder(Pages.SITE + "/down").fetchLatencyMs(9000).build();

        assertThat(check.check(fast, Pages.index(fast))).isEmpty();
        assertThat(check.check(slow, Pages.index(slow))).singleElement()
                .satisfies(f -> assertThat(f.getEvidence()).containsEntry("latencyMs", "2500"));
        assertThat(check.check(failed, Pages.index(failed))).isEmpty();
    }
}
