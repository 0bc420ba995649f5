package org.smileyface.siteaudit.crawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw links into the canonical absolute form used as the crawl identity key.
 * <p>
 * Resolution against a base follows RFC 3986; afterwards the scheme and host are lower-cased,
 * default ports, fragments, user-info and dot segments are removed, percent-escapes are upper-cased,
 * the trailing slash policy is applied and configured tracking parameters are dropped from the query.
 * Only http and https URLs are admitted. Instances are immutable and safe for concurrent use, and
 * normalizing an already normalized URL returns it unchanged.
 */
public final class UrlNormalizer {

    private static final Pattern PERCENT_ESCAPE = Pattern.compile("%[0-9a-fA-F]{2}");
    private static final String ILLEGAL_CHARACTERS = " |\"<>{}^`\\";

    private final TrailingSlashPolicy trailingSlashPolicy;
    private final List<String> exactParams = new ArrayList<>();
    private final List<String> prefixParams = new ArrayList<>();

    /**
     * @param trailingSlashPolicy policy for trailing slashes on non-root paths (null means PRESERVE)
     * @param stripQueryParams    query parameter names to remove; an entry ending in {@code *} is a prefix
     */
    public UrlNormalizer(TrailingSlashPolicy trailingSlashPolicy, Collection<String> stripQueryParams) {
        this.trailingSlashPolicy = trailingSlashPolicy == null ? TrailingSlashPolicy.PRESERVE : trailingSlashPolicy;
        if (stripQueryParams != null) {
            for (String p : stripQueryParams) {
                if (p == null || p.isBlank()) continue;
                String name = p.trim().toLowerCase(Locale.ROOT);
                if (name.endsWith("*")) {
                    prefixParams.add(name.substring(0, name.length() - 1));
                } else {
                    exactParams.add(name);
                }
            }
        }
    }

    /** Normalizer that keeps paths and queries as found. */
    public static UrlNormalizer lenient() {
        return new UrlNormalizer(TrailingSlashPolicy.PRESERVE, List.of());
    }

    public String normalize(String raw) throws NormalizationException {
        return normalize(raw, null);
    }

    /**
     * Normalizes {@code raw}, resolving it against {@code base} first when it is relative.
     *
     * @param raw  link as found in a document or header
     * @param base absolute URL the link is relative to, may be null
     * @return the normalized absolute URL
     * @throws NormalizationException when the link is malformed or not http(s)
     */
    public String normalize(String raw, String base) throws NormalizationException {
        if (raw == null || raw.isBlank()) {
            throw new NormalizationException(raw, NormalizationException.Reason.MALFORMED, "Empty URL");
        }
        URI uri;
        try {
            uri = new URI(escapeIllegalCharacters(raw.trim()));
            if (base != null && !uri.isAbsolute()) {
                uri = resolve(baseUri(base), uri);
            }
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new NormalizationException(raw, NormalizationException.Reason.MALFORMED,
                    "Unparseable URL: " + e.getMessage(), e);
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new NormalizationException(raw, NormalizationException.Reason.MALFORMED,
                    "Relative URL without a base");
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new NormalizationException(raw, NormalizationException.Reason.UNSUPPORTED_SCHEME,
                    "Unsupported scheme: " + scheme);
        }
        if (uri.isOpaque()) {
            throw new NormalizationException(raw, NormalizationException.Reason.MALFORMED, "Opaque http URL");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new NormalizationException(raw, NormalizationException.Reason.MALFORMED, "Missing or invalid host");
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        int port = uri.getPort();
        if (port != -1 && port != defaultPort(scheme)) {
            sb.append(':').append(port);
        }
        sb.append(normalizePath(uri.getRawPath()));
        String query = filterQuery(uri.getRawQuery());
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Returns {@code scheme://host[:port]} of a normalized URL, the key used for per-host state.
     */
    public static String originOf(String normalizedUrl) {
        URI uri = URI.create(normalizedUrl);
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getHost());
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        return sb.toString();
    }

    /** Host part of a normalized URL, or null when it has none. */
    public static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (Exception e) {
            return null;
        }
    }

    private static URI baseUri(String base) throws URISyntaxException {
        URI b = new URI(escapeIllegalCharacters(base.trim()));
        if (b.getRawAuthority() != null && (b.getRawPath() == null || b.getRawPath().isEmpty())) {
            b = new URI(b.getScheme() + "://" + b.getRawAuthority() + "/");
        }
        return b;
    }

    private static URI resolve(URI base, URI ref) throws URISyntaxException {
        // java.net.URI drops the last base segment for query-only references
        boolean queryOnly = ref.getRawAuthority() == null
                && (ref.getRawPath() == null || ref.getRawPath().isEmpty())
                && ref.getRawQuery() != null;
        if (queryOnly) {
            String b = base.toString();
            int cut = indexOfAny(b, '?', '#');
            if (cut >= 0) b = b.substring(0, cut);
            return new URI(b + "?" + ref.getRawQuery());
        }
        return base.resolve(ref);
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }

    private String normalizePath(String rawPath) {
        String path = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath;
        path = removeDotSegments(path);
        path = upperCaseEscapes(path);
        if (path.equals("/")) {
            return path;
        }
        switch (trailingSlashPolicy) {
            case STRIP -> {
                while (path.length() > 1 && path.endsWith("/")) {
                    path = path.substring(0, path.length() - 1);
                }
            }
            case ADD -> {
                String last = path.substring(path.lastIndexOf('/') + 1);
                if (!path.endsWith("/") && !last.contains(".")) {
                    path = path + "/";
                }
            }
            default -> {
                // keep as is
            }
        }
        return path;
    }

    private static String removeDotSegments(String path) {
        String[] parts = path.substring(1).split("/", -1);
        List<String> out = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i];
            boolean last = i == parts.length - 1;
            if (p.equals(".")) {
                if (last) out.add("");
            } else if (p.equals("..")) {
                if (!out.isEmpty()) out.remove(out.size() - 1);
                if (last) out.add("");
            } else {
                out.add(p);
            }
        }
        return "/" + String.join("/", out);
    }

    private String filterQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            String name = pair.split("=", 2)[0].toLowerCase(Locale.ROOT);
            if (isTrackingParam(name)) continue;
            kept.add(upperCaseEscapes(pair));
        }
        return kept.isEmpty() ? null : String.join("&", kept);
    }

    private boolean isTrackingParam(String name) {
        if (exactParams.contains(name)) return true;
        for (String prefix : prefixParams) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    private static String upperCaseEscapes(String s) {
        if (s.indexOf('%') < 0) return s;
        Matcher m = PERCENT_ESCAPE.matcher(s);
        StringBuilder sb = new StringBuilder(s.length());
        while (m.find()) {
            m.appendReplacement(sb, m.group().toUpperCase(Locale.ROOT));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String escapeIllegalCharacters(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            String replacement = null;
            if (ILLEGAL_CHARACTERS.indexOf(c) >= 0) {
                replacement = String.format("%%%02X", (int) c);
            } else if (c == '%' && !isEscape(s, i)) {
                replacement = "%25";
            }
            if (replacement != null && sb == null) {
                sb = new StringBuilder(s.length() + 8);
                sb.append(s, 0, i);
            }
            if (sb != null) {
                if (replacement != null) sb.append(replacement);
                else sb.append(c);
            }
        }
        return sb == null ? s : sb.toString();
    }

    private static boolean isEscape(String s, int i) {
        return i + 2 < s.length()
                && Character.digit(s.charAt(i + 1), 16) >= 0
                && Character.digit(s.charAt(i + 2), 16) >= 0;
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
