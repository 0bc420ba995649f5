package org.smileyface.siteaudit.check;

import org.smileyface.siteaudit.crawler.CrawlConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Open, ordered registry of checks keyed by id. Ids are unique; a check registered twice under the
 * same id is rejected.
 */
public class CheckRegistry {

    private final Map<String, AuditCheck> checks = new LinkedHashMap<>();

    /**
     * Registry holding every built-in check, configured with the given thresholds.
     */
    public static CheckRegistry withDefaults(CrawlConfig.CheckSettings settings) {
        CheckRegistry r = new CheckRegistry();
        r.register(StatusIntegrityCheck.ID, new StatusIntegrityCheck(settings.redirectHopLimit()));
        r.register(MobileMetaCheck.ID, new MobileMetaCheck());
        r.register(DuplicateContentCheck.ID, new DuplicateContentCheck());
        r.register(MetaQualityCheck.ID, new MetaQualityCheck(settings.titleMinLength(), settings.titleMaxLength(),
                settings.descriptionMinLength(), settings.descriptionMaxLength()));
        r.register(StructuredDataCheck.ID, new StructuredDataCheck());
        r.register(BrokenInternalLinkCheck.ID, new BrokenInternalLinkCheck());
        r.register(MalformedMarkupCheck.ID, new MalformedMarkupCheck());
        r.register(MalformedLinkCheck.ID, new MalformedLinkCheck());
        r.register(HeadingStructureCheck.ID, new HeadingStructureCheck());
        r.register(CanonicalIntegrityCheck.ID, new CanonicalIntegrityCheck());
        r.register(IndexabilityCheck.ID, new IndexabilityCheck());
        r.register(HreflangCheck.ID, new HreflangCheck());
        r.register(SlowResponseCheck.ID, new SlowResponseCheck(settings.slowResponse()));
        return r;
    }

    public synchronized CheckRegistry register(String id, AuditCheck check) {
        Objects.requireNonNull(check, "check");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Check id is required");
        }
        if (checks.containsKey(id)) {
            throw new IllegalArgumentException("Check already registered: " + id);
        }
        checks.put(id, check);
        return this;
    }

    public synchronized boolean contains(String id) {
        return checks.containsKey(id);
    }

    /** Snapshot of the registered checks in registration order. */
    public synchronized Map<String, AuditCheck> checks() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }
}
