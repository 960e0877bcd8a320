package org.netpreserve.archivescope.analysis;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TagStrippingTextExtractorTest {
    private final TagStrippingTextExtractor extractor = new TagStrippingTextExtractor();

    @Test
    public void stripsMarkupAndInvisibleContent() {
        var page = Pages.html("https://example.com/", """
                <html><head><title>Widgets &amp; Gadgets</title>
                <style>body { color: red }</style>
                <script type="text/javascript">var widgets = 1;</script>
                </head>
                <body><!-- widgets in a comment -->
                <h1>Best&nbsp;widgets</h1><p>Caf&#233; &#x263A; &lt;3</p>
                <noscript>enable widgets</noscript>
                </body></html>
                """);
        assertEquals("Widgets & Gadgets Best widgets Café ☺ <3", extractor.text(page));
    }

    @Test
    public void leavesNonHtmlAlone() {
        var page = Pages.page("https://example.com/a.txt", Map.of("content-type", "text/plain"),
                "a <b>  literal\n\ntext");
        assertEquals("a <b> literal text", extractor.text(page));
    }

    @Test
    public void keepsUnknownEntities() {
        assertEquals("&bogus; &#xZZ;", TagStrippingTextExtractor.decodeEntities("&bogus; &#xZZ;"));
    }
}
