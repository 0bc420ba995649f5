package org.smileyface.siteaudit.check;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON-LD blocks must parse as JSON, and each top-level object should declare an {@code @context}.
 */
public final class StructuredDataCheck implements AuditCheck {

    public static final String ID = "structured-data-validity";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public List<Finding> check(PageModel page, CrawlIndex index) {
        List<Finding> out = new ArrayList<>();
        int n = 0;
        for (PageModel.StructuredDataBlock block : page.getStructuredData()) {
            n++;
            if (!"json-ld".equals(block.format())) continue;
            JsonNode root;
            try {
                root = MAPPER.readTree(block.content());
            } catch (JsonProcessingException e) {
                out.add(Finding.builder(ID, page.getUrl()).issue("invalid-json-ld").severity(Severity.WARNING)
                        .message("JSON-LD block " + n + " does not parse: " + e.getOriginalMessage())
                        .evidence("block", n)
                        .build());
                continue;
            }
            if (root == null || root.isMissingNode()) {
                out.add(Finding.builder(ID, page.getUrl()).issue("invalid-json-ld").severity(Severity.WARNING)
                        .message("JSON-LD block " + n + " is empty")
                        .evidence("block", n)
                        .build());
                continue;
            }
            if (!hasContext(root)) {
                out.add(Finding.builder(ID, page.getUrl()).issue("missing-context").severity(Severity.INFO)
                        .message("JSON-LD block " + n + " has no @context")
                        .evidence("block", n)
                        .build());
            }
        }
        return out;
    }

    private static boolean hasContext(JsonNode node) {
        if (node.isArray()) {
            if (node.isEmpty()) return false;
            for (JsonNode item : node) {
                if (!hasContext(item)) return false;
            }
            return true;
        }
        return node.isObject() && node.has("@context");
    }
}
