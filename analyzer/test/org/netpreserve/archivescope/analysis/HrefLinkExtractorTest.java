package org.netpreserve.archivescope.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HrefLinkExtractorTest {
    private final HrefLinkExtractor extractor = new HrefLinkExtractor();

    @Test
    public void keepsSameHostLinksResolvedAndDeduplicated() {
        var page = Pages.html("https://example.com/blog/", """
                <a href="/about">About</a>
                <a href='post-1#comments'>Post</a>
                <a href=post-1>Post again</a>
                <a href="https://EXAMPLE.com/contact?x=1&amp;y=2">Contact</a>
                <a href="https://other.example.org/">Elsewhere</a>
                <a href="https://sub.example.com/">Subdomain</a>
                <a href="mailto:info@example.com">Mail</a>
                <a href="#top">Top</a>
                <a href="https://example.com/blog/">Self</a>
                """);
        assertEquals(List.of(
                "https://example.com/about",
                "https://example.com/blog/post-1",
                "https://EXAMPLE.com/contact?x=1&y=2"), extractor.internalLinks(page));
    }

    @Test
    public void honoursBaseHref() {
        var page = Pages.html("https://example.com/a/b/c.html",
                "<base href=\"https://example.com/docs/\"><a href=\"intro.html\">Intro</a>");
        assertEquals(List.of("https://example.com/docs/intro.html"), extractor.internalLinks(page));
    }

    @Test
    public void ignoresUnparseableInput() {
        assertEquals(List.of(), extractor.internalLinks(Pages.html("not a url", "<a href=\"/x\">x</a>")));
        assertEquals(List.of(), extractor.internalLinks(Pages.html("https://example.com/",
                "<a href=\"http://[bad\">x</a>")));
    }
}
