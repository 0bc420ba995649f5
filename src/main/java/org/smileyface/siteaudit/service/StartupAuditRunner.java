package org.smileyface.siteaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.siteaudit.crawler.CrawlerProperties;
import org.smileyface.siteaudit.model.AuditReport;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Audits {@code crawler.seed-url} once at startup and writes the report to {@code crawler.report-file}.
 * Enabled with {@code crawler.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "crawler", name = "run-on-startup", havingValue = "true")
public class StartupAuditRunner implements ApplicationRunner {

    private static final Logger log = LogManager.getLogger();

    private final SiteAuditService service;
    private final CrawlerProperties properties;
    private final ObjectMapper mapper;

    public StartupAuditRunner(SiteAuditService service, CrawlerProperties properties, ObjectMapper mapper) {
        this.service = service;
        this.properties = properties;
        this.mapper = mapper;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException, InterruptedException {
        String seed = properties.getSeedUrl();
        if (seed == null || seed.isBlank()) {
            log.warn("crawler.run-on-startup is set but crawler.seed-url is empty; nothing to audit");
            return;
        }
        AuditReport report = service.audit(seed);
        Path out = Path.of(properties.getReportFile());
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(out.toFile(), report);
        log.info("Audit report for {} written to {} ({} finding(s))", seed, out.toAbsolutePath(),
                report.getFindings().size());
    }
}
