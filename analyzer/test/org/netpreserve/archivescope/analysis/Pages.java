package org.netpreserve.archivescope.analysis;

import org.netpreserve.archivescope.fetch.FetchedPage;

import java.util.Map;

final class Pages {
    private Pages() {
    }

    static FetchedPage html(String url, String body) {
        return page(url, Map.of("content-type", "text/html"), body);
    }

    static FetchedPage page(String url, Map<String, String> headers, String body) {
        return new FetchedPage(url, "CC-MAIN-2024-10", 200, headers, body, "text/html", "20240301120000",
                body.length(), false);
    }
}
