package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Title and meta description quality: present, within length bounds and unique across the site.
 * Missing and duplicate values are warnings; lengths outside the bounds are informational.
 */
public final class MetaQualityCheck implements AuditCheck {

    public static final String ID = "meta-quality";

    private final int titleMin;
    private final int titleMax;
    private final int descriptionMin;
    private final int descriptionMax;

    public MetaQualityCheck(int titleMin, int titleMax, int descriptionMin, int descriptionMax) {
        if (titleMin > titleMax || descriptionMin > descriptionMax) {
            throw new IllegalArgumentException("Minimum length must not exceed maximum length");
        }
        this.titleMin = titleMin;
        this.titleMax = titleMax;
        this.descriptionMin = descriptionMin;
        this.descriptionMax = descriptionMax;
    }

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        if (!page.isAuditableHtml()) return List.of();
        List<Finding> out = new ArrayList<>();
        inspect(out, page, "title", page.getTitle(), titleMin, titleMax, index::urlsWithTitle);
        inspect(out, page, "description", page.meta("description"), descriptionMin, descriptionMax,
                index::urlsWithDescription);
        return out;
    }

    private void inspect(List<Finding> out, PageModel page, String field, String value, int min, int max,
                         Function<String, Set<String>> sameValue) {
        String url = page.getUrl();
        String text = value == null ? "" : value.trim();
        if (text.isEmpty()) {
            out.add(Finding.builder(ID, url).issue("missing-" + field).severity(Severity.WARNING)
                    .message("No " + field)
                    .build());
            return;
        }
        int len = text.length();
        if (len < min) {
            out.add(Finding.builder(ID, url).issue(field + "-too-short").severity(Severity.INFO)
                    .message(capitalize(field) + " has " + len + " characters, minimum is " + min)
                    .evidence(field, text)
                    .evidence("length", len)
                    .build());
        } else if (len > max) {
            out.add(Finding.builder(ID, url).issue(field + "-too-long").severity(Severity.INFO)
                    .message(capitalize(field) + " has " + len + " characters, maximum is " + max)
                    .evidence(field, text)
                    .evidence("length", len)
                    .build());
        }
        Set<String> others = new TreeSet<>(sameValue.apply(text));
        others.remove(url);
        if (!others.isEmpty()) {
            out.add(Finding.builder(ID, url).issue("duplicate-" + field).severity(Severity.WARNING)
                    .message(capitalize(field) + " shared with " + others.size() + " other page(s)")
                    .evidence(field, text)
                    .evidence("duplicates", String.join(", ", others))
                    .build());
        }
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
