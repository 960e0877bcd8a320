package org.netpreserve.archivescope.analysis;

import org.netpreserve.archivescope.fetch.FetchedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code <a href>} targets, resolved against the page URL (or its
 * {@code <base href>}), keeping http(s) links to the page's own host. Links back to the page
 * itself are dropped.
 */
public class HrefLinkExtractor implements LinkExtractor {
    private static final Logger log = LoggerFactory.getLogger(HrefLinkExtractor.class);
    private static final Pattern ANCHOR_HREF = Pattern.compile(
            "(?is)<a\\b[^>]*?\\bhref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))");
    private static final Pattern BASE_HREF = Pattern.compile(
            "(?is)<base\\b[^>]*?\\bhref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))");

    @Override
    public List<String> internalLinks(FetchedPage page) {
        URI pageUri;
        try {
            pageUri = new URI(page.url());
        } catch (URISyntaxException e) {
            log.debug("Unparseable page URL {}", page.url());
            return List.of();
        }
        String host = pageUri.getHost();
        if (host == null) return List.of();

        URI base = pageUri;
        Matcher baseMatcher = BASE_HREF.matcher(page.body());
        if (baseMatcher.find()) {
            URI resolved = resolve(pageUri, attributeValue(baseMatcher));
            if (resolved != null) base = resolved;
        }

        String self = withoutFragment(pageUri).toString();
        var links = new LinkedHashSet<String>();
        Matcher matcher = ANCHOR_HREF.matcher(page.body());
        while (matcher.find()) {
            URI target = resolve(base, attributeValue(matcher));
            if (target == null || target.getHost() == null) continue;
            String scheme = target.getScheme() == null ? "" : target.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) continue;
            if (!target.getHost().equalsIgnoreCase(host)) continue;
            String link = withoutFragment(target).toString();
            if (!link.equals(self)) links.add(link);
        }
        return new ArrayList<>(links);
    }

    private static String attributeValue(Matcher matcher) {
        for (int group = 1; group <= 3; group++) {
            if (matcher.group(group) != null) return unescape(matcher.group(group).trim());
        }
        return "";
    }

    private static String unescape(String value) {
        return value.replace("&amp;", "&").replace("&#38;", "&");
    }

    private static URI resolve(URI base, String href) {
        if (href.isEmpty() || href.startsWith("#")) return null;
        try {
            return base.resolve(new URI(href.replace(" ", "%20")));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    private static URI withoutFragment(URI uri) {
        if (uri.getRawFragment() == null) return uri;
        String s = uri.toString();
        return URI.create(s.substring(0, s.indexOf('#')));
    }
}
