package com.dailybrief.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>", Pattern.DOTALL);
    private static final Pattern ENTITY_PATTERN = Pattern.compile("&(#\\d+|#[xX][0-9a-fA-F]+|[a-zA-Z]+);");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "amp", "&",
            "lt", "<",
            "gt", ">",
            "quot", "\"",
            "apos", "'",
            "nbsp", " ",
            "hellip", "…",
            "mdash", "—",
            "ndash", "–"
    );

    private HtmlUtils() {
    }

    /**
     * Drops markup, decodes the common character references and collapses runs of whitespace.
     */
    public static String toPlainText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String withoutTags = TAG_PATTERN.matcher(html).replaceAll(" ");
        String decoded = decodeEntities(withoutTags);
        return WHITESPACE_PATTERN.matcher(decoded).replaceAll(" ").trim();
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} chars, never splitting a surrogate pair, and appends
     * {@code suffix} only when something was kept.
     */
    public static String truncate(String text, int maxLength, String suffix) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String kept = text;
        if (text.length() > maxLength) {
            int end = Math.max(0, maxLength);
            if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            kept = text.substring(0, end).trim();
        }
        if (kept.isEmpty()) {
            return "";
        }
        return suffix == null ? kept : kept + suffix;
    }

    public static boolean isHttpLink(String link) {
        if (link == null || link.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(link.trim());
            String scheme = uri.getScheme();
            if (scheme == null) {
                return false;
            }
            String lowered = scheme.toLowerCase(Locale.ROOT);
            return ("http".equals(lowered) || "https".equals(lowered)) && uri.getHost() != null;
        } catch (Exception e) {
            return false;
        }
    }

    private static String decodeEntities(String text) {
        Matcher matcher = ENTITY_PATTERN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(decodeEntity(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String decodeEntity(String body, String original) {
        if (body.startsWith("#")) {
            try {
                int codePoint = body.startsWith("#x") || body.startsWith("#X")
                        ? Integer.parseInt(body.substring(2), 16)
                        : Integer.parseInt(body.substring(1));
                return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : original;
            } catch (NumberFormatException e) {
                return original;
            }
        }
        return NAMED_ENTITIES.getOrDefault(body.toLowerCase(Locale.ROOT), original);
    }
}
