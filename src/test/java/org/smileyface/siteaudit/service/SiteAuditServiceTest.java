package org.smileyface.siteaudit.service;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.siteaudit.crawler.CrawlConfig;
import org.smileyface.siteaudit.crawler.CrawlerProperties;
import org.smileyface.siteaudit.crawler.InvalidConfigurationException;
import org.smileyface.siteaudit.model.AuditReport;
import org.smileyface.siteaudit.model.Finding;
import org.smileyface.siteaudit.model.OutcomeKind;
import org.smileyface.siteaudit.model.Severity;
import org.smileyface.siteaudit.model.TerminationReason;
import org.smileyface.siteaudit.model.UrlRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end audits against a small site served by an in-process HTTP server.
 */
@SpringBootTest
@ActiveProfiles("test")
class SiteAuditServiceTest {

    private static final Logger logger = LogManager.getLogger(SiteAuditServiceTest.class);

    private static final String HOME = "<html><head><title>Home page of the site</title>"
            + "<meta name='viewport' content='width=device-width, initial-scale=1'></head><body>"
            + "<h1>Home</h1>"
            + "<a href='/about'>About</a> <a href='/old'>Old</a> <a href='/missing'>Missing</a>"
            + "<a href='/err'>Err</a> <a href='/private/secret'>Secret</a> <a href='/loop1'>Loop</a>"
            + "<a href='mailto:someone@example.com'>Mail</a> <a href='https://elsewhere.example.org/'>Out</a>"
            + "</body></html>";

    private static final String ABOUT = "<html><head><title>About this site</title></head>"
            + "<body><h1>About</h1><a href='/'>Home</a></body></html>";

    @Autowired
    private SiteAuditService service;

    @Autowired
    private CrawlerProperties crawlerProperties;

    private HttpServer server;
    private String base;
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        logger.info("Test site at {}", base);
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        hits.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
        switch (path) {
            case "/" -> send(ex, 200, "text/html; charset=UTF-8", HOME);
            case "/about" -> send(ex, 200, "text/html; charset=UTF-8", ABOUT);
            case "/robots.txt" -> send(ex, 200, "text/plain", "User-agent: *\nDisallow: /private\n");
            case "/old" -> redirect(ex, "/about");
            case "/loop1" -> redirect(ex, "/loop2");
            case "/loop2" -> redirect(ex, "/loop1");
            case "/err" -> send(ex, 500, "text/html", "<h1>oops</h1>");
            default -> send(ex, 404, "text/html", "<h1>not found</h1>");
        }
    }

    private static void send(HttpExchange ex, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", contentType);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void redirect(HttpExchange ex, String location) throws IOException {
        ex.getResponseHeaders().add("Location", location);
        ex.sendResponseHeaders(301, -1);
        ex.close();
    }

    private int hits(String path) {
        AtomicInteger n = hits.get(path);
        return n == null ? 0 : n.get();
    }

    @Test
    void audit_buildsInventoryAndFindingsForWholeSite() throws Exception {
        AuditReport report = service.audit(base + "/");

        assertThat(report.getTerminationReason()).isEqualTo(TerminationReason.DRAINED);
        assertThat(report.getInventory()).containsOnlyKeys(
                base + "/", base + "/about", base + "/old", base + "/missing", base + "/err",
                base + "/private/secret", base + "/loop1");

        UrlRecord old = report.record(base + "/old");
        assertThat(old.getOutcome()).isEqualTo(OutcomeKind.FETCHED);
        assertThat(old.getFinalUrl()).isEqualTo(base + "/about");

        UrlRecord err = report.record(base + "/err");
        assertThat(err.getOutcome()).isEqualTo(OutcomeKind.FAILED);
        assertThat(err.getAttempts()).isEqualTo(3);
        assertThat(hits("/err")).isEqualTo(3);

        assertThat(report.record(base + "/private/secret").getOutcome()).isEqualTo(OutcomeKind.SKIPPED_ROBOTS);
        assertThat(hits("/private/secret")).isZero();
        assertThat(hits("/robots.txt")).isEqualTo(1);

        assertThat(report.record(base + "/missing").getStatusCode()).isEqualTo(404);
        assertThat(report.record(base + "/loop1").getOutcome()).isEqualTo(OutcomeKind.FAILED);

        assertThat(report.findingsFor(base + "/loop1")).extracting(Finding::getIssue).contains("redirect-loop");
        assertThat(report.findingsFor(base + "/err"))
                .anySatisfy(f -> {
                    assertThat(f.getCheckId()).isEqualTo("status-integrity");
                    assertThat(f.getSeverity()).isEqualTo(Severity.CRITICAL);
                });
        assertThat(report.findingsFor(base + "/"))
                .filteredOn(f -> f.getCheckId().equals("broken-internal-link"))
                .extracting(f -> f.getEvidence().get("target"))
                .contains(base + "/missing", base + "/err")
                .doesNotContain(base + "/private/secret");
        assertThat(report.findingsFor(base + "/old")).extracting(Finding::getIssue).doesNotContain("redirect-chain");
        assertThat(report.findingsOf("duplicate-content")).extracting(Finding::getUrl)
                .containsExactlyInAnyOrder(base + "/old", base + "/about");

        assertThat(report.getSummary().getPagesSkippedRobots()).isEqualTo(1);
        assertThat(report.getSummary().getUniqueFinalUrls()).isLessThan(report.getSummary().getPagesFetched());
        assertThat(service.activeProgress()).isEmpty();
    }

    @Test
    void audit_respectsPageBudget() throws Exception {
        CrawlerProperties props = crawlerProperties.copy();
        props.setMaxPages(2);

        AuditReport report = service.audit(CrawlConfig.from(props, base + "/"));

        assertThat(report.getInventory()).hasSize(2).containsKey(base + "/");
        assertThat(report.getTerminationReason()).isEqualTo(TerminationReason.MAX_PAGES);
    }

    @Test
    void audit_respectsDepthLimit() throws Exception {
        CrawlerProperties props = crawlerProperties.copy();
        props.setMaxDepth(0);

        AuditReport report = service.audit(CrawlConfig.from(props, base + "/"));

        assertThat(report.getInventory()).containsOnlyKeys(base + "/");
        assertThat(report.getTerminationReason()).isEqualTo(TerminationReason.DRAINED);
        assertThat(hits("/about")).isZero();
    }

    @Test
    void audit_disabledChecksProduceNoFindings() throws Exception {
        CrawlerProperties props = crawlerProperties.copy();
        props.getChecks().getDisabled().add("status-integrity");

        AuditReport report = service.audit(CrawlConfig.from(props, base + "/"));

        assertThat(report.findingsOf("status-integrity")).isEmpty();
        assertThat(report.findingsOf("broken-internal-link")).isNotEmpty();
    }

    @Test
    void audit_invalidSeedIsRejectedBeforeFetching() {
        assertThatThrownBy(() -> service.audit("not a url"))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThat(hits).isEmpty();
    }
}
