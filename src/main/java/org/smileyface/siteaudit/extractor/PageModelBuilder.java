package org.smileyface.siteaudit.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.siteaudit.crawler.CrawlTask;
import org.smileyface.siteaudit.crawler.NormalizationException;
import org.smileyface.siteaudit.crawler.UrlNormalizer;
import org.smileyface.siteaudit.fetch.FetchResult;
import org.smileyface.siteaudit.model.PageModel;
import org.smileyface.siteaudit.util.CrawlerUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a {@link FetchResult} into the read-only {@link PageModel} the checks consume.
 * <p>
 * HTML is parsed with jsoup with error tracking on; links are resolved against {@code <base href>}
 * or the final URL and normalized. Non-navigational schemes (mailto, tel, javascript, data, sms) are
 * skipped; links that cannot be normalized are kept as malformed links. Responses that are not HTML
 * and failed fetches get a minimal model. Truncated bodies are parsed but get no body hash. Builders are stateless and may be shared between workers.
 */
public final class PageModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(PageModelBuilder.class);

    static final int MAX_TRACKED_PARSE_ERRORS = 50;

    private static final Set<String> IGNORED_SCHEMES = Set.of("mailto:", "tel:", "javascript:", "data:", "sms:");
    private static final String RESOURCE_SELECTOR =
            "img[src], script[src], iframe[src], source[src], video[src], audio[src], embed[src]";

    private final UrlNormalizer normalizer;

    public PageModelBuilder(UrlNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public PageModel build(CrawlTask task, FetchResult result) {
        PageModel.Builder b = PageModel.builder(task.url())
                .finalUrl(result.getFinalUrl())
                .depth(task.depth())
                .statusCode(result.hasResponse() ? result.getStatusCode() : 0)
                .contentType(result.getContentType())
                .headers(result.getHeaders())
                .fetchLatencyMs(result.getLatencyMs())
                .fetchError(result.errorMessage())
                .redirectChain(result.getRedirectChain())
                .redirectLoop(result.isRedirectLoop())
                .tooManyRedirects(result.isTooManyRedirects())
                .robotsBlockedUrl(result.getRobotsBlockedUrl())
                .bodyTruncated(result.isBodyTruncated());

        byte[] body = result.getBody();
        if (body == null) {
            return b.build();
        }
        b.byteSize(body.length);
        if (result.isRedirectFailure() || !isHtml(result.getContentType(), body)) {
            return b.build();
        }

        b.html(true);
        try {
            extractHtml(b, result, body);
        } catch (IOException | RuntimeException e) {
            log.debug("Parse failure for {}: {}", task.url(), e.toString());
            b.parseError("Parse failure: " + e.getMessage());
        }
        return b.build();
    }

    private void extractHtml(PageModel.Builder b, FetchResult result, byte[] body) throws IOException {
        String finalUrl = result.getFinalUrl();
        Parser parser = Parser.htmlParser().setTrackErrors(MAX_TRACKED_PARSE_ERRORS);
        Document doc = Jsoup.parse(new ByteArrayInputStream(body), charsetOf(result.getContentType()), finalUrl, parser);
        for (ParseError e : parser.getErrors()) {
            b.parseError(e.getPosition() + ": " + e.getErrorMessage());
        }

        // a cut body cannot prove an exact duplicate
        if (!result.isBodyTruncated()) {
            Charset charset = doc.charset();
            b.bodyHash(CrawlerUtils.bodyHash(new String(body, charset)));
        }

        Element titleEl = doc.selectFirst("title");
        if (titleEl != null) {
            b.title(titleEl.text());
        }
        for (Element meta : doc.select("meta[name], meta[property]")) {
            String name = meta.hasAttr("name") ? meta.attr("name") : meta.attr("property");
            if (name.isBlank()) continue;
            b.metaTag(name.trim().toLowerCase(Locale.ROOT), meta.attr("content"));
        }
        for (Element h : doc.select("h1, h2, h3, h4, h5, h6")) {
            b.heading(h.tagName().charAt(1) - '0', h.text());
        }

        String base = finalUrl;
        Element baseEl = doc.selectFirst("base[href]");
        if (baseEl != null) {
            try {
                base = normalizer.normalize(baseEl.attr("href"), finalUrl);
            } catch (NormalizationException e) {
                b.malformedLink(baseEl.attr("href"));
            }
        }

        for (Element a : doc.select("a[href], area[href]")) {
            String link = resolve(b, a.attr("href"), base);
            if (link != null) b.outboundLink(link);
        }
        for (Element el : doc.select(RESOURCE_SELECTOR)) {
            String link = resolve(b, el.attr("src"), base);
            if (link != null) b.resourceLink(link);
        }

        for (Element link : doc.select("link[href]")) {
            Set<String> rel = relTokens(link);
            String href = link.attr("href");
            if (rel.contains("stylesheet") || rel.contains("icon")) {
                String resolved = resolve(b, href, base);
                if (resolved != null) b.resourceLink(resolved);
            }
            if (rel.contains("canonical")) {
                try {
                    b.canonical(normalizer.normalize(href, base));
                } catch (NormalizationException e) {
                    b.canonicalRaw(href);
                }
            }
            if (rel.contains("alternate") && link.hasAttr("hreflang")) {
                String resolved;
                try {
                    resolved = normalizer.normalize(href, base);
                } catch (NormalizationException e) {
                    resolved = href;
                }
                b.hreflang(link.attr("hreflang").trim(), resolved);
            }
        }

        for (Element script : doc.select("script[type]")) {
            String type = script.attr("type").trim().toLowerCase(Locale.ROOT);
            if (type.equals("application/ld+json")) {
                b.structuredData("json-ld", script.data());
            }
        }
    }

    /** Normalized link, or null when it is empty, non-navigational or malformed (the latter recorded). */
    private String resolve(PageModel.Builder b, String raw, String base) {
        if (raw == null || raw.isBlank()) return null;
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String scheme : IGNORED_SCHEMES) {
            if (lower.startsWith(scheme)) return null;
        }
        try {
            return normalizer.normalize(trimmed, base);
        } catch (NormalizationException e) {
            if (e.getReason() == NormalizationException.Reason.MALFORMED) {
                b.malformedLink(trimmed);
            }
            return null;
        }
    }

    private static Set<String> relTokens(Element link) {
        return Arrays.stream(link.attr("rel").toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    static boolean isHtml(String contentType, byte[] body) {
        String type = CrawlerUtils.mediaType(contentType);
        if (type != null) {
            return type.equals("text/html") || type.equals("application/xhtml+xml");
        }
        for (byte c : body) {
            if (!Character.isWhitespace(c)) {
                return c == '<';
            }
        }
        return false;
    }

    /** Charset named in the content type, or null to let jsoup detect it. */
    static String charsetOf(String contentType) {
        if (contentType == null) return null;
        for (String part : List.of(contentType.split(";"))) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String cs = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.isSupported(cs) ? cs : null;
                } catch (IllegalCharsetNameException e) {
                    log.debug("Ignoring illegal charset name '{}'", cs);
                    return null;
                }
            }
        }
        return null;
    }
}
