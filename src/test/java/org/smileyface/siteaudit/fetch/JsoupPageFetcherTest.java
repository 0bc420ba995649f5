package org.smileyface.siteaudit.fetch;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class JsoupPageFetcherTest {

    private static final int LIMIT = 64;

    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String body = ex.getRequestURI().getPath().equals("/long")
                    ? "<html><body>" + "x".repeat(500) + "</body></html>"
                    : "<html>short</html>";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=UTF-8");
            ex.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void get_flagsBodyCutAtSizeLimit() throws Exception {
        JsoupPageFetcher fetcher = new JsoupPageFetcher("siteauditbot", Duration.ofSeconds(5), LIMIT);

        FetchResponse cut = fetcher.get(base + "/long");
        FetchResponse whole = fetcher.get(base + "/short");

        assertThat(cut.body()).hasSize(LIMIT);
        assertThat(cut.truncated()).isTrue();
        assertThat(whole.truncated()).isFalse();
        assertThat(new String(whole.body(), StandardCharsets.UTF_8)).isEqualTo("<html>short</html>");
    }

    @Test
    void isTruncated_trustsContentLengthWhenBodyFillsLimit() {
        JsoupPageFetcher fetcher = new JsoupPageFetcher("siteauditbot", Duration.ofSeconds(5), LIMIT);

        assertThat(fetcher.isTruncated(LIMIT - 1, null)).isFalse();
        assertThat(fetcher.isTruncated(LIMIT, String.valueOf(LIMIT))).isFalse();
        assertThat(fetcher.isTruncated(LIMIT, "1000")).isTrue();
        assertThat(fetcher.isTruncated(LIMIT, "bogus")).isTrue();
        assertThat(fetcher.isTruncated(LIMIT, null)).isTrue();
        assertThat(new JsoupPageFetcher("siteauditbot", Duration.ofSeconds(5), 0).isTruncated(10_000, null)).isFalse();
    }
}
