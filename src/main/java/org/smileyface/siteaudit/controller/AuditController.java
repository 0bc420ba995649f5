package org.smileyface.siteaudit.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.crawler.CrawlConfig;
import org.smileyface.siteaudit.crawler.CrawlerProperties;
import org.smileyface.siteaudit.crawler.InvalidConfigurationException;
import org.smileyface.siteaudit.model.AuditReport;
import org.smileyface.siteaudit.model.CrawlProgress;
import org.smileyface.siteaudit.service.SiteAuditService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/audits")
class AuditController {

    private static final Logger log = LoggerFactory.getLogger(AuditController.class);

    private final SiteAuditService service;
    private final CrawlerProperties properties;

    AuditController(SiteAuditService service, CrawlerProperties properties) {
        this.service = service;
        this.properties = properties;
    }

    /** Runs an audit synchronously and returns the report. */
    @PostMapping
    public AuditReport audit(@RequestBody AuditRequest request) throws InterruptedException {
        CrawlConfig config = CrawlConfig.from(request.applyTo(properties.copy()));
        return service.audit(config);
    }

    @GetMapping("/progress")
    public List<CrawlProgress> progress() {
        return service.activeProgress();
    }

    @PostMapping("/stop")
    public Map<String, Integer> stop() {
        return Map.of("stopped", service.stopAll());
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    ResponseEntity<Map<String, String>> invalidConfiguration(InvalidConfigurationException e) {
        log.info("Rejected audit request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }
}
