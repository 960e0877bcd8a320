package org.netpreserve.archivescope.analysis;

import org.netpreserve.archivescope.fetch.FetchedPage;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximates the visible text of an HTML page by dropping script, style and comment
 * content, replacing tags with spaces and decoding common character references. Non-HTML
 * bodies are returned with whitespace collapsed.
 */
public class TagStrippingTextExtractor implements TextExtractor {
    private static final Pattern INVISIBLE = Pattern.compile(
            "(?is)<!--.*?-->|<(script|style|noscript|template)\\b[^>]*>.*?</\\1\\s*>");
    private static final Pattern TAG = Pattern.compile("(?s)<[^>]*>");
    private static final Pattern ENTITY = Pattern.compile("&(#x[0-9a-fA-F]+|#\\d+|[a-zA-Z]+);");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "amp", "&", "lt", "<", "gt", ">", "quot", "\"", "apos", "'", "nbsp", " ");

    @Override
    public String text(FetchedPage page) {
        String body = page.body();
        if (looksLikeHtml(page)) {
            body = INVISIBLE.matcher(body).replaceAll(" ");
            body = TAG.matcher(body).replaceAll(" ");
            body = decodeEntities(body);
        }
        return WHITESPACE.matcher(body).replaceAll(" ").trim();
    }

    private static boolean looksLikeHtml(FetchedPage page) {
        String contentType = page.header("content-type");
        if (contentType == null) contentType = page.mimeType();
        if (contentType == null) return true;
        contentType = contentType.toLowerCase(Locale.ROOT);
        return contentType.contains("html") || contentType.contains("xml");
    }

    static String decodeEntities(String text) {
        Matcher matcher = ENTITY.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(decodeEntity(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String decodeEntity(String entity, String original) {
        try {
            if (entity.startsWith("#x") || entity.startsWith("#X")) {
                return Character.toString(Integer.parseInt(entity.substring(2), 16));
            } else if (entity.startsWith("#")) {
                return Character.toString(Integer.parseInt(entity.substring(1)));
            }
        } catch (IllegalArgumentException e) {
            return original;
        }
        return NAMED_ENTITIES.getOrDefault(entity.toLowerCase(Locale.ROOT), original);
    }
}
