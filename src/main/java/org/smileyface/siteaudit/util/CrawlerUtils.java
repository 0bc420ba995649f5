package org.smileyface.siteaudit.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

public class CrawlerUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Collapses every run of whitespace into a single space and trims the result.
     * Null is treated as empty.
     */
    public static String collapseWhitespace(String input) {
        if (input == null) {
            return "";
        }
        return WHITESPACE.matcher(input).replaceAll(" ").trim();
    }

    /**
     * Hash used for exact duplicate detection: SHA-256 hex over the whitespace-collapsed body,
     * so pages that differ only in indentation or line breaks collide.
     */
    public static String bodyHash(String body) {
        return sha256Hex(collapseWhitespace(body));
    }

    public static String sha256Hex(String input) {
        byte[] data = (input == null ? "" : input).getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed to exist on all Java platforms
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static long durationMs(Instant start, Instant end) {
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }

    /**
     * Media type without parameters, lower-cased, e.g. "text/html" for "text/html; charset=UTF-8".
     */
    public static String mediaType(String contentType) {
        if (contentType == null) return null;
        int semi = contentType.indexOf(';');
        String type = semi >= 0 ? contentType.substring(0, semi) : contentType;
        type = type.trim().toLowerCase(Locale.ROOT);
        return type.isEmpty() ? null : type;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
