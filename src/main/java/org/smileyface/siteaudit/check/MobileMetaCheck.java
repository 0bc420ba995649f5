package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks the viewport meta tag of HTML pages: present, sized to the device width and not disabling zoom.
 */
public final class MobileMetaCheck implements AuditCheck {

    public static final String ID = "mobile-meta";

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml()) return List.of();
        List<Finding> out = new ArrayList<>();
        String viewport = page.meta("viewport");
        if (viewport == null || viewport.isBlank()) {
            out.add(Finding.builder(ID, page.getUrl()).issue("missing-viewport").severity(Severity.WARNING)
                    .message("No viewport meta tag")
                    .build());
            return out;
        }
        Map<String, String> props = parse(viewport);
        if (!"device-width".equals(props.get("width"))) {
            out.add(Finding.builder(ID, page.getUrl()).issue("viewport-not-device-width").severity(Severity.WARNING)
                    .message("Viewport does not set width=device-width")
                    .evidence("viewport", viewport)
                    .build());
        }
        String scalable = props.get("user-scalable");
        String maxScale = props.get("maximum-scale");
        if ("no".equals(scalable) || "0".equals(scalable) || isAtMostOne(maxScale)) {
            out.add(Finding.builder(ID, page.getUrl()).issue("zoom-disabled").severity(Severity.INFO)
                    .message("Viewport prevents users from zooming")
                    .evidence("viewport", viewport)
                    .build());
        }
        return out;
    }

    static Map<String, String> parse(String viewport) {
        Map<String, String> props = new HashMap<>();
        for (String part : viewport.toLowerCase(Locale.ROOT).split("[,;]")) {
            int eq = part.indexOf('=');
            if (eq < 0) continue;
            props.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
        }
        return props;
    }

    private static boolean isAtMostOne(String scale) {
        if (scale == null || scale.isEmpty()) return false;
        try {
            return Double.parseDouble(scale) <= 1.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
