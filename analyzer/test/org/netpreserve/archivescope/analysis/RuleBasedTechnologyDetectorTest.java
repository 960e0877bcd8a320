package org.netpreserve.archivescope.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedTechnologyDetectorTest {
    private final RuleBasedTechnologyDetector detector = RuleBasedTechnologyDetector.withBuiltInRules();

    private static List<String> names(List<Technology> technologies) {
        return technologies.stream().map(Technology::name).toList();
    }

    @Test
    public void detectsFromHeadersGeneratorAndBody() {
        var page = Pages.page("https://example.com/", Map.of(
                        "server", "nginx/1.25.3",
                        "x-powered-by", "PHP/8.2",
                        "cf-ray", "8a1b2c3d4e-AMS"),
                """
                <html><head>
                <meta name="generator" content="WordPress 6.4.3">
                <script src="/wp-includes/js/jquery/jquery.min.js"></script>
                <script async src="https://www.googletagmanager.com/gtag/js?id=G-XYZ"></script>
                </head><body>Hello</body></html>
                """);
        var detected = detector.detect(page);
        var names = names(detected);

        assertTrue(names.containsAll(List.of("WordPress", "jQuery", "PHP", "Google Analytics", "Cloudflare",
                "Nginx")), names.toString());
        assertFalse(names.contains("Apache"));
        assertTrue(detected.contains(new Technology("WordPress", "cms")));
        assertEquals(names.size(), Set.copyOf(names).size());
    }

    @Test
    public void plainPageDetectsNothing() {
        assertEquals(List.of(), detector.detect(Pages.page("https://example.com/", Map.of(), "<p>plain</p>")));
    }

    @Test
    public void customRules() {
        var custom = new RuleBasedTechnologyDetector(List.of(
                new RuleBasedTechnologyDetector.Rule("Varnish", "cdn", Map.of("X-Varnish", ""), null, null),
                new RuleBasedTechnologyDetector.Rule("Ghost", "cms", null, List.of("Ghost"), null)));
        var page = Pages.page("https://example.com/", Map.of("x-varnish", "12345"),
                "<meta content='Ghost 5.0' name='generator'>");
        assertEquals(List.of("Varnish", "Ghost"), names(custom.detect(page)));
    }

    @Test
    public void readsGeneratorMetaTag() {
        assertEquals("hugo 0.120.0",
                RuleBasedTechnologyDetector.generator("<META NAME=generator CONTENT=\"Hugo 0.120.0\">"));
        assertNull(RuleBasedTechnologyDetector.generator("<meta name=\"description\" content=\"x\">"));
    }
}
